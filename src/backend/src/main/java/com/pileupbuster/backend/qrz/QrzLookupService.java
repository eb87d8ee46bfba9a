package com.pileupbuster.backend.qrz;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.pileupbuster.backend.config.PileupProperties;
import com.pileupbuster.backend.model.CallsignProfile;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Resolves callsign profiles from the QRZ.com XML data service with Redis-backed caching.
 *
 * <p>A session key is obtained with the configured account and reused until QRZ reports it as
 * expired. Failures of any kind are cached briefly as error profiles so a flapping upstream is
 * not hammered by repeated registrations. Cache entries carry a Redis TTL; an unreachable Redis
 * degrades to uncached lookups.
 */
@Service
public class QrzLookupService implements CallsignLookup {
  private static final Logger log = LoggerFactory.getLogger(QrzLookupService.class);
  private static final String AGENT = "pileup-buster";

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final PileupProperties.Qrz properties;
  private final HttpClient httpClient;
  private final XmlMapper xmlMapper = new XmlMapper();
  private final Counter cacheHitCounter;
  private final Counter successCounter;
  private final Counter notFoundCounter;
  private final Counter errorCounter;
  private final Counter loginCounter;

  private volatile String sessionKey;

  @Autowired
  public QrzLookupService(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      PileupProperties properties,
      MeterRegistry meterRegistry) {
    this(redisTemplate, objectMapper, properties, meterRegistry, HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(300, properties.getQrz().getTimeoutMs())))
        .build());
  }

  QrzLookupService(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      PileupProperties properties,
      MeterRegistry meterRegistry,
      HttpClient httpClient) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties.getQrz();
    this.httpClient = httpClient;
    this.cacheHitCounter = meterRegistry.counter("pileup.qrz.lookups.total", "outcome", "cache_hit");
    this.successCounter = meterRegistry.counter("pileup.qrz.lookups.total", "outcome", "success");
    this.notFoundCounter = meterRegistry.counter("pileup.qrz.lookups.total", "outcome", "not_found");
    this.errorCounter = meterRegistry.counter("pileup.qrz.lookups.total", "outcome", "error");
    this.loginCounter = meterRegistry.counter("pileup.qrz.logins.total");
  }

  @Override
  public CallsignProfile lookup(String callsign) {
    if (isBlank(properties.getUsername()) || isBlank(properties.getPassword())) {
      errorCounter.increment();
      return CallsignProfile.failed(
          "QRZ.com credentials not configured. Please set QRZ_USERNAME and QRZ_PASSWORD.");
    }

    String key = callsign.toUpperCase(Locale.ROOT);
    String cacheKey = properties.getRedisKeyPrefix() + "profile:" + key;
    CallsignProfile cached = readCached(cacheKey);
    if (cached != null) {
      cacheHitCounter.increment();
      return cached;
    }

    CallsignProfile profile = fetch(key);
    cache(cacheKey, profile);
    return profile;
  }

  private CallsignProfile readCached(String cacheKey) {
    String payload;
    try {
      payload = redisTemplate.opsForValue().get(cacheKey);
    } catch (DataAccessException ex) {
      log.warn("QRZ cache read failed for {}: {}", cacheKey, ex.getMessage());
      return null;
    }
    if (payload == null || payload.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(payload, CallsignProfile.class);
    } catch (JsonProcessingException ex) {
      log.debug("Discarding unreadable QRZ cache entry {}", cacheKey);
      return null;
    }
  }

  private void cache(String cacheKey, CallsignProfile profile) {
    long ttl = profile.hasError()
        ? Math.max(5L, properties.getErrorCacheTtlSeconds())
        : Math.max(60L, properties.getCacheTtlSeconds());
    try {
      String payload = objectMapper.writeValueAsString(profile);
      redisTemplate.opsForValue().set(cacheKey, payload, ttl, TimeUnit.SECONDS);
    } catch (JsonProcessingException | DataAccessException ex) {
      log.warn("QRZ cache write failed for {}: {}", cacheKey, ex.getMessage());
    }
  }

  private CallsignProfile fetch(String callsign) {
    try {
      String key = currentSessionKey();
      JsonNode root = get("s=" + encode(key) + ";callsign=" + encode(callsign));
      String sessionError = root.path("Session").path("Error").asText(null);
      if (sessionError != null && isSessionExpired(sessionError)) {
        log.info("QRZ session expired, logging in again");
        sessionKey = null;
        root = get("s=" + encode(currentSessionKey()) + ";callsign=" + encode(callsign));
        sessionError = root.path("Session").path("Error").asText(null);
      }

      JsonNode record = root.path("Callsign");
      if (record.isMissingNode() || record.isNull()) {
        notFoundCounter.increment();
        String message = sessionError != null ? sessionError : "No QRZ.com profile found for callsign " + callsign;
        return CallsignProfile.failed(message);
      }

      successCounter.increment();
      return toProfile(record);
    } catch (QrzException ex) {
      errorCounter.increment();
      log.warn("QRZ lookup failed for {}: {}", callsign, ex.getMessage());
      return CallsignProfile.failed(ex.getMessage());
    } catch (IOException | InterruptedException | RuntimeException ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      errorCounter.increment();
      log.warn("QRZ lookup failed for {}", callsign, ex);
      return CallsignProfile.failed("QRZ.com lookup failed: " + ex.getClass().getSimpleName());
    }
  }

  private String currentSessionKey() throws IOException, InterruptedException {
    String key = sessionKey;
    if (key != null) {
      return key;
    }
    synchronized (this) {
      if (sessionKey != null) {
        return sessionKey;
      }
      loginCounter.increment();
      JsonNode root = get("username=" + encode(properties.getUsername())
          + ";password=" + encode(properties.getPassword())
          + ";agent=" + AGENT);
      JsonNode session = root.path("Session");
      String newKey = session.path("Key").asText(null);
      if (isBlank(newKey)) {
        String error = session.path("Error").asText("no session key returned");
        throw new QrzException("QRZ.com authentication failed: " + error);
      }
      sessionKey = newKey;
      log.info("Logged in to QRZ.com as {}", properties.getUsername());
      return newKey;
    }
  }

  private JsonNode get(String query) throws IOException, InterruptedException {
    String baseUrl = properties.getBaseUrl().endsWith("/") ? properties.getBaseUrl() : properties.getBaseUrl() + "/";
    HttpRequest request = HttpRequest.newBuilder()
        .GET()
        .uri(URI.create(baseUrl + "?" + query))
        .timeout(Duration.ofMillis(Math.max(300, properties.getTimeoutMs())))
        .header("Accept", "application/xml")
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new QrzException("QRZ.com returned HTTP " + status);
    }
    return xmlMapper.readTree(response.body());
  }

  private static CallsignProfile toProfile(JsonNode record) {
    String name = joinNonBlank(" ", text(record, "fname"), text(record, "name"));
    String address = joinNonBlank(", ",
        text(record, "addr1"),
        text(record, "addr2"),
        joinNonBlank(" ", text(record, "state"), text(record, "zip")),
        text(record, "country"));
    String dxccName = text(record, "country") != null ? text(record, "country") : text(record, "land");
    CallsignProfile.Grid grid = new CallsignProfile.Grid(
        number(record, "lat"), number(record, "lon"), text(record, "grid"));
    return new CallsignProfile(name, address, dxccName, text(record, "image"), grid, null);
  }

  private static boolean isSessionExpired(String error) {
    String normalized = error.toLowerCase(Locale.ROOT);
    return normalized.contains("session timeout") || normalized.contains("invalid session key");
  }

  private static String text(JsonNode record, String field) {
    JsonNode node = record.path(field);
    if (node.isMissingNode() || node.isNull()) {
      return null;
    }
    String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }

  private static Double number(JsonNode record, String field) {
    String value = text(record, field);
    if (value == null) {
      return null;
    }
    try {
      return Double.valueOf(value);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static String joinNonBlank(String separator, String... parts) {
    List<String> present = new ArrayList<>();
    for (String part : parts) {
      if (!isBlank(part)) {
        present.add(part);
      }
    }
    return present.isEmpty() ? null : String.join(separator, present);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static final class QrzException extends RuntimeException {
    QrzException(String message) {
      super(message);
    }
  }
}
