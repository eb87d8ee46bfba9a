package com.pileupbuster.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pileupbuster.backend.store.InMemoryStateStore;
import com.pileupbuster.backend.store.RedisStateStore;
import com.pileupbuster.backend.store.StateStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Selects the state store implementation from {@code pileup.store.type}. */
@Configuration
public class StoreConfig {
  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Bean
  @ConditionalOnProperty(prefix = "pileup.store", name = "type", havingValue = "redis", matchIfMissing = true)
  public StateStore redisStateStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      PileupProperties properties) {
    log.info("Using Redis state store with key prefix '{}'", properties.getStore().getKeyPrefix());
    return new RedisStateStore(redisTemplate, objectMapper, properties.getStore().getKeyPrefix());
  }

  @Bean
  @ConditionalOnProperty(prefix = "pileup.store", name = "type", havingValue = "memory")
  public StateStore inMemoryStateStore() {
    log.warn("Using in-memory state store: state is lost on restart");
    return new InMemoryStateStore();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
