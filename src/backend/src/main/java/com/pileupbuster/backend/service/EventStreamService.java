package com.pileupbuster.backend.service;

import com.pileupbuster.backend.config.PileupProperties;
import com.pileupbuster.backend.events.EventBus;
import com.pileupbuster.backend.events.EventType;
import com.pileupbuster.backend.events.StreamEvent;
import com.pileupbuster.backend.events.Subscription;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-Sent Events gateway between the {@link EventBus} and connected viewers.
 *
 * <p>Each connection subscribes to the bus, receives a {@code connected} greeting and is then
 * fed by its own pump task draining the subscription in publish order. A {@code keepalive} is
 * published through the bus on a fixed interval. Any delivery failure, emitter completion,
 * timeout or mailbox overflow closes the connection and releases its subscription.
 */
@Service
public class EventStreamService {
  private static final Logger log = LoggerFactory.getLogger(EventStreamService.class);
  private static final Duration POLL_TIMEOUT = Duration.ofSeconds(1);

  /** Lifecycle of one viewer connection. */
  enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSED
  }

  private final EventBus eventBus;
  private final PileupProperties.Stream properties;
  private final ExecutorService pumpExecutor;
  private final Clock clock;
  private final Set<StreamConnection> connections = ConcurrentHashMap.newKeySet();
  private final AtomicLong nextConnectionId = new AtomicLong(1);
  private final Counter openedCounter;
  private final ScheduledExecutorService keepaliveScheduler =
      Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "pileup-stream-keepalive");
        thread.setDaemon(true);
        return thread;
      });

  @Autowired
  public EventStreamService(
      EventBus eventBus,
      PileupProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this(eventBus, properties, meterRegistry, clock, newPumpPool());
  }

  EventStreamService(
      EventBus eventBus,
      PileupProperties properties,
      MeterRegistry meterRegistry,
      Clock clock,
      ExecutorService pumpExecutor) {
    this.eventBus = eventBus;
    this.properties = properties.getStream();
    this.clock = clock;
    this.pumpExecutor = pumpExecutor;
    this.openedCounter = meterRegistry.counter("pileup.stream.connections.opened.total");
    meterRegistry.gaugeCollectionSize("pileup.stream.connections.open", Tags.empty(), connections);
  }

  @PostConstruct
  public void start() {
    long intervalMs = Math.max(1_000L, properties.getKeepaliveInterval().toMillis());
    keepaliveScheduler.scheduleAtFixedRate(this::publishKeepalive, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    log.info("Event stream keepalive every {} ms", intervalMs);
  }

  @PreDestroy
  public void stop() {
    keepaliveScheduler.shutdownNow();
    for (StreamConnection connection : connections) {
      close(connection, "shutdown");
      completeSilently(connection.emitter);
    }
    pumpExecutor.shutdownNow();
  }

  /**
   * Opens an SSE stream for one viewer.
   *
   * @return emitter already carrying the {@code connected} event
   */
  public SseEmitter openStream() {
    SseEmitter emitter = createEmitter();
    StreamConnection connection =
        new StreamConnection(nextConnectionId.getAndIncrement(), emitter, eventBus.subscribe());
    connections.add(connection);
    openedCounter.increment();

    emitter.onCompletion(() -> close(connection, "completed"));
    emitter.onTimeout(() -> close(connection, "timeout"));
    emitter.onError(ex -> close(connection, "error"));

    Instant now = clock.instant();
    Map<String, Object> greeting = new LinkedHashMap<>();
    greeting.put("connectionId", connection.id);
    greeting.put("serverTime", now.toString());
    if (!send(connection, new StreamEvent(EventType.CONNECTED, greeting, now))) {
      return emitter;
    }

    if (!connection.state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
      return emitter;
    }
    try {
      pumpExecutor.execute(() -> pump(connection));
    } catch (RejectedExecutionException ex) {
      log.warn("Stream {} rejected: pump pool is shut down", connection.id);
      close(connection, "rejected");
      completeSilently(emitter);
    }
    log.debug("Stream {} open. Total connections: {}", connection.id, connections.size());
    return emitter;
  }

  int connectionCount() {
    return connections.size();
  }

  SseEmitter createEmitter() {
    return new SseEmitter(properties.getEmitterTimeoutMs());
  }

  void publishKeepalive() {
    try {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("serverTime", clock.instant().toString());
      payload.put("connections", connections.size());
      eventBus.publish(EventType.KEEPALIVE, payload);
    } catch (RuntimeException ex) {
      log.warn("Keepalive publish failed", ex);
    }
  }

  private void pump(StreamConnection connection) {
    Subscription subscription = connection.subscription;
    try {
      while (connection.state.get() == ConnectionState.OPEN) {
        StreamEvent event = subscription.poll(POLL_TIMEOUT);
        if (event != null) {
          if (!send(connection, event)) {
            return;
          }
        } else if (subscription.isClosed()) {
          log.info("Stream {} dropped: subscriber fell behind", connection.id);
          close(connection, "overflow");
          completeSilently(connection.emitter);
          return;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      close(connection, "interrupted");
      completeSilently(connection.emitter);
    }
  }

  private boolean send(StreamConnection connection, StreamEvent event) {
    String eventName = event.type().wireName();
    try {
      connection.emitter.send(SseEmitter.event().name(eventName).data(event, MediaType.APPLICATION_JSON));
      return true;
    } catch (Exception ex) {
      close(connection, "send-failed");
      if (isExpectedClientDisconnect(ex)) {
        log.debug("SSE client disconnected during {} delivery: {}", eventName, rootCauseSummary(ex));
        completeSilently(connection.emitter);
        return false;
      }
      log.warn("SSE event delivery failed for event={}", eventName, ex);
      completeWithErrorSilently(connection.emitter, ex);
      return false;
    }
  }

  private void close(StreamConnection connection, String reason) {
    if (connection.state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
      return;
    }
    eventBus.unsubscribe(connection.subscription);
    connections.remove(connection);
    log.debug("Stream {} closed ({}). Total connections: {}", connection.id, reason, connections.size());
  }

  static boolean isExpectedClientDisconnect(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String className = current.getClass().getName();
      if (className.endsWith("ClientAbortException") || className.endsWith("EofException")
          || className.endsWith("AsyncRequestNotUsableException")) {
        return true;
      }
      if (hasDisconnectMessage(current.getMessage())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static boolean hasDisconnectMessage(String message) {
    if (message == null || message.isBlank()) {
      return false;
    }
    String normalized = message.toLowerCase(Locale.ROOT);
    return normalized.contains("broken pipe")
        || normalized.contains("connection reset")
        || normalized.contains("socket closed")
        || normalized.contains("stream closed")
        || normalized.contains("connection abort")
        || normalized.contains("forcibly closed by the remote host");
  }

  private static String rootCauseSummary(Throwable error) {
    Throwable current = error;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    if (message == null || message.isBlank()) {
      return current.getClass().getSimpleName();
    }
    return current.getClass().getSimpleName() + ": " + message;
  }

  private static void completeSilently(SseEmitter emitter) {
    try {
      emitter.complete();
    } catch (Exception ex) {
      log.debug("Emitter already closed: {}", ex.getMessage());
    }
  }

  private static void completeWithErrorSilently(SseEmitter emitter, Exception error) {
    try {
      emitter.completeWithError(error);
    } catch (Exception ex) {
      log.debug("Emitter already closed: {}", ex.getMessage());
    }
  }

  private static ExecutorService newPumpPool() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, "pileup-stream-pump-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /** One viewer: emitter, bus subscription and lifecycle state. */
  private static final class StreamConnection {
    private final long id;
    private final SseEmitter emitter;
    private final Subscription subscription;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);

    private StreamConnection(long id, SseEmitter emitter, Subscription subscription) {
      this.id = id;
      this.emitter = emitter;
      this.subscription = subscription;
    }
  }
}
