package com.pileupbuster.backend.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pileupbuster.backend.model.CurrentContact;
import com.pileupbuster.backend.model.QueueEntry;
import com.pileupbuster.backend.model.SystemSettings;
import com.pileupbuster.backend.model.WorkedRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed store keeping each aggregate as one JSON document.
 *
 * <p>Key layout (prefix configurable, default {@code pileup:}):
 * <ul>
 *   <li>{@code queue}: JSON array of queue entries in FIFO order</li>
 *   <li>{@code current}: JSON object, absent when idle</li>
 *   <li>{@code worked}: JSON array of worked records</li>
 *   <li>{@code settings}: JSON object</li>
 * </ul>
 *
 * <p>Commits run inside {@code MULTI/EXEC} so multi-aggregate transitions land together.
 */
public class RedisStateStore implements StateStore {
  private static final Logger log = LoggerFactory.getLogger(RedisStateStore.class);
  private static final TypeReference<List<QueueEntry>> QUEUE_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<WorkedRecord>> WORKED_TYPE = new TypeReference<>() {};

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String queueKey;
  private final String currentKey;
  private final String workedKey;
  private final String settingsKey;

  public RedisStateStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.queueKey = keyPrefix + "queue";
    this.currentKey = keyPrefix + "current";
    this.workedKey = keyPrefix + "worked";
    this.settingsKey = keyPrefix + "settings";
  }

  @Override
  public List<QueueEntry> queue() {
    String payload = redisTemplate.opsForValue().get(queueKey);
    return payload == null ? List.of() : read(payload, QUEUE_TYPE);
  }

  @Override
  public Optional<CurrentContact> currentContact() {
    String payload = redisTemplate.opsForValue().get(currentKey);
    return payload == null ? Optional.empty() : Optional.of(read(payload, CurrentContact.class));
  }

  @Override
  public List<WorkedRecord> workedHistory() {
    String payload = redisTemplate.opsForValue().get(workedKey);
    return payload == null ? List.of() : read(payload, WORKED_TYPE);
  }

  @Override
  public SystemSettings settings() {
    String payload = redisTemplate.opsForValue().get(settingsKey);
    return payload == null ? SystemSettings.defaults() : read(payload, SystemSettings.class);
  }

  @Override
  public void commit(StateMutation mutation) {
    if (mutation.isEmpty()) {
      return;
    }

    // Nothing may throw between MULTI and EXEC: encode first.
    Map<String, String> writes = new LinkedHashMap<>();
    boolean deleteCurrent = false;
    if (mutation.hasQueue()) {
      writes.put(queueKey, write(mutation.getQueue()));
    }
    if (mutation.hasCurrentContact()) {
      if (mutation.getCurrentContact() == null) {
        deleteCurrent = true;
      } else {
        writes.put(currentKey, write(mutation.getCurrentContact()));
      }
    }
    if (mutation.hasWorkedHistory()) {
      writes.put(workedKey, write(mutation.getWorkedHistory()));
    }
    if (mutation.hasSettings()) {
      writes.put(settingsKey, write(mutation.getSettings()));
    }

    boolean clearCurrent = deleteCurrent;
    List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
      @Override
      @SuppressWarnings("unchecked")
      public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
        RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
        ops.multi();
        writes.forEach((key, value) -> ops.opsForValue().set(key, value));
        if (clearCurrent) {
          ops.delete(currentKey);
        }
        return ops.exec();
      }
    });
    log.debug("Committed {} aggregate writes (clearCurrent={}), results={}", writes.size(), clearCurrent, results);
  }

  private <T> T read(String payload, TypeReference<T> type) {
    try {
      return objectMapper.readValue(payload, type);
    } catch (JsonProcessingException ex) {
      throw new StateStoreException("Unreadable state document", ex);
    }
  }

  private <T> T read(String payload, Class<T> type) {
    try {
      return objectMapper.readValue(payload, type);
    } catch (JsonProcessingException ex) {
      throw new StateStoreException("Unreadable state document of type " + type.getSimpleName(), ex);
    }
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new StateStoreException("Unable to encode state document", ex);
    }
  }
}
