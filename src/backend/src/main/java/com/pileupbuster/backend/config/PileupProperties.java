package com.pileupbuster.backend.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the pileup backend.
 *
 * <p>Values are bound from {@code pileup.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "pileup")
public class PileupProperties {
  private final Queue queue = new Queue();
  private final Worked worked = new Worked();
  private final Stream stream = new Stream();
  private final Store store = new Store();
  private final Admin admin = new Admin();
  private final Qrz qrz = new Qrz();
  private final LoggerIntegration loggerIntegration = new LoggerIntegration();
  private final Api api = new Api();

  public Queue getQueue() {
    return queue;
  }

  public Worked getWorked() {
    return worked;
  }

  public Stream getStream() {
    return stream;
  }

  public Store getStore() {
    return store;
  }

  public Admin getAdmin() {
    return admin;
  }

  public Qrz getQrz() {
    return qrz;
  }

  public LoggerIntegration getLoggerIntegration() {
    return loggerIntegration;
  }

  public Api getApi() {
    return api;
  }

  /** Waiting-line limits. */
  public static class Queue {
    private int maxSize = 4;

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }
  }

  /** Retention of completed contacts. */
  public static class Worked {
    private Duration ttl = Duration.ofHours(24);
    private Duration sweepInterval = Duration.ofMinutes(1);

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public Duration getSweepInterval() {
      return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
    }
  }

  /** Live event stream settings. */
  public static class Stream {
    private Duration keepaliveInterval = Duration.ofSeconds(30);
    private int subscriberBufferSize = 256;
    private long emitterTimeoutMs = 0L;

    public Duration getKeepaliveInterval() {
      return keepaliveInterval;
    }

    public void setKeepaliveInterval(Duration keepaliveInterval) {
      this.keepaliveInterval = keepaliveInterval;
    }

    public int getSubscriberBufferSize() {
      return subscriberBufferSize;
    }

    public void setSubscriberBufferSize(int subscriberBufferSize) {
      this.subscriberBufferSize = subscriberBufferSize;
    }

    public long getEmitterTimeoutMs() {
      return emitterTimeoutMs;
    }

    public void setEmitterTimeoutMs(long emitterTimeoutMs) {
      this.emitterTimeoutMs = emitterTimeoutMs;
    }
  }

  /** State store backend selection and Redis key layout. */
  public static class Store {
    private String type = "redis";
    private String keyPrefix = "pileup:";

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }
  }

  /** Admin credentials checked on {@code /api/admin/**}. */
  public static class Admin {
    private String username;
    private String password;

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }
  }

  /** QRZ.com XML lookup settings used for callsign enrichment. */
  public static class Qrz {
    private boolean enabled = true;
    private String username;
    private String password;
    private String baseUrl = "https://xmldata.qrz.com/xml/current/";
    private int timeoutMs = 5000;
    private long cacheTtlSeconds = 3600;
    private long errorCacheTtlSeconds = 60;
    private String redisKeyPrefix = "pileup:qrz:";
    private int lookupThreads = 2;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public int getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public long getCacheTtlSeconds() {
      return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
      this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public long getErrorCacheTtlSeconds() {
      return errorCacheTtlSeconds;
    }

    public void setErrorCacheTtlSeconds(long errorCacheTtlSeconds) {
      this.errorCacheTtlSeconds = errorCacheTtlSeconds;
    }

    public String getRedisKeyPrefix() {
      return redisKeyPrefix;
    }

    public void setRedisKeyPrefix(String redisKeyPrefix) {
      this.redisKeyPrefix = redisKeyPrefix;
    }

    public int getLookupThreads() {
      return lookupThreads;
    }

    public void setLookupThreads(int lookupThreads) {
      this.lookupThreads = lookupThreads;
    }
  }

  /** WSJT-X UDP target used to announce started contacts to logging software. */
  public static class LoggerIntegration {
    private String host = "127.0.0.1";
    private int port = 2237;
    private String appName = "PileupBuster";
    private String defaultMode = "SSB";

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public String getAppName() {
      return appName;
    }

    public void setAppName(String appName) {
      this.appName = appName;
    }

    public String getDefaultMode() {
      return defaultMode;
    }

    public void setDefaultMode(String defaultMode) {
      this.defaultMode = defaultMode;
    }
  }

  /** API-level behavior configuration (CORS, rate limits). */
  public static class Api {
    private final Cors cors = new Cors();
    private final RateLimit rateLimit = new RateLimit();

    public Cors getCors() {
      return cors;
    }

    public RateLimit getRateLimit() {
      return rateLimit;
    }
  }

  /** CORS allowlist configuration for frontend consumers. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }

  /** Rate limiting applied to public queue writes. */
  public static class RateLimit {
    private int windowSeconds = 60;
    private int maxRequests = 20;

    public int getWindowSeconds() {
      return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
      this.windowSeconds = windowSeconds;
    }

    public int getMaxRequests() {
      return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
      this.maxRequests = maxRequests;
    }
  }
}
