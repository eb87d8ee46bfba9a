package com.pileupbuster.bridge.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pileupbuster.bridge.config.BridgeProperties;
import com.pileupbuster.bridge.udp.LoggedContact;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reports logged contacts to the backend as direct starts.
 *
 * <p>Every failure is logged and counted; nothing propagates into the UDP receive loop.
 */
@Component
public class BackendClient {
  private static final Logger log = LoggerFactory.getLogger(BackendClient.class);
  static final String SOURCE = "bridge";

  private final BridgeProperties.Backend properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter rejectedCounter;
  private final Counter errorCounter;

  public BackendClient(
      BridgeProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.properties = properties.backend();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.requestTimer = Timer.builder("bridge.backend.http.duration")
        .description("Direct start HTTP request duration (seconds)")
        .register(meterRegistry);
    this.successCounter = Counter.builder("bridge.backend.forwards.total")
        .description("Logged contacts forwarded to the backend (by outcome)")
        .tag("outcome", "success")
        .register(meterRegistry);
    this.rejectedCounter = Counter.builder("bridge.backend.forwards.total")
        .description("Logged contacts forwarded to the backend (by outcome)")
        .tag("outcome", "rejected")
        .register(meterRegistry);
    this.errorCounter = Counter.builder("bridge.backend.forwards.total")
        .description("Logged contacts forwarded to the backend (by outcome)")
        .tag("outcome", "error")
        .register(meterRegistry);
  }

  /**
   * Posts the contact to {@code /api/admin/qso/start}.
   *
   * @return true when the backend accepted the direct start
   */
  public boolean forward(LoggedContact contact) {
    long startNs = System.nanoTime();
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(trimTrailingSlash(properties.baseUrl()) + "/api/admin/qso/start"))
          .timeout(Duration.ofMillis(Math.max(300L, properties.timeoutMs())))
          .header("Content-Type", "application/json")
          .header("Authorization", basicAuth(properties.username(), properties.password()))
          .POST(HttpRequest.BodyPublishers.ofString(body(contact)))
          .build();

      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
      int status = response.statusCode();
      if (status >= 200 && status < 300) {
        successCounter.increment();
        log.info("Forwarded {} to backend", contact.callsign());
        return true;
      }
      rejectedCounter.increment();
      log.warn("Backend rejected {}: status={} body={}", contact.callsign(), status, response.body());
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      errorCounter.increment();
      log.error("Forwarding {} interrupted", contact.callsign(), ex);
      return false;
    } catch (Exception ex) {
      errorCounter.increment();
      log.error("Failed to forward {} to backend", contact.callsign(), ex);
      return false;
    }
  }

  String body(LoggedContact contact) throws JsonProcessingException {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("callsign", contact.callsign());
    if (contact.frequencyMhz() != null) {
      payload.put("frequency", String.format(Locale.ROOT, "%.6f", contact.frequencyMhz()));
    }
    if (contact.mode() != null) {
      payload.put("mode", contact.mode());
    }
    payload.put("source", SOURCE);
    return objectMapper.writeValueAsString(payload);
  }

  private static String basicAuth(String username, String password) {
    String raw = (username == null ? "" : username) + ":" + (password == null ? "" : password);
    return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
  }

  private static String trimTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
