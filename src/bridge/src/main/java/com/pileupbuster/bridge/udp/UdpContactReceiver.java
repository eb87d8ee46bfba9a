package com.pileupbuster.bridge.udp;

import com.pileupbuster.bridge.backend.BackendClient;
import com.pileupbuster.bridge.config.BridgeProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Listens for logging-software datagrams and forwards each new contact to the backend.
 *
 * <p>Repeats of the same callsign inside the dedupe window are dropped; loggers commonly emit
 * both a "QSO logged" and a "logged ADIF" frame for one contact.
 */
@Component
public class UdpContactReceiver {
  private static final Logger log = LoggerFactory.getLogger(UdpContactReceiver.class);
  private static final int RECEIVE_TIMEOUT_MS = 1_000;

  private final BridgeProperties.Udp properties;
  private final Duration dedupeWindow;
  private final LoggedContactParser parser;
  private final BackendClient backendClient;
  private final Map<String, Instant> lastForwarded = new ConcurrentHashMap<>();
  private final Counter receivedCounter;
  private final Counter unparsedCounter;
  private final Counter duplicateCounter;

  private volatile boolean running;
  private volatile DatagramSocket socket;
  private Thread worker;

  public UdpContactReceiver(
      BridgeProperties properties,
      LoggedContactParser parser,
      BackendClient backendClient,
      MeterRegistry meterRegistry) {
    this.properties = properties.udp();
    this.dedupeWindow = properties.dedupeWindow() == null ? Duration.ZERO : properties.dedupeWindow();
    this.parser = parser;
    this.backendClient = backendClient;
    this.receivedCounter = meterRegistry.counter("bridge.udp.packets.total", "outcome", "parsed");
    this.unparsedCounter = meterRegistry.counter("bridge.udp.packets.total", "outcome", "unparsed");
    this.duplicateCounter = meterRegistry.counter("bridge.udp.packets.total", "outcome", "duplicate");
  }

  @PostConstruct
  public void start() throws IOException {
    if (!properties.enabled()) {
      log.info("UDP receiver disabled");
      return;
    }
    DatagramSocket bound = new DatagramSocket(null);
    bound.setReuseAddress(true);
    bound.setSoTimeout(RECEIVE_TIMEOUT_MS);
    bound.bind(new InetSocketAddress(InetAddress.getByName(properties.bindAddress()), properties.port()));
    socket = bound;
    running = true;
    worker = new Thread(this::receiveLoop, "bridge-udp-receiver");
    worker.setDaemon(true);
    worker.start();
    log.info("UDP receiver listening on {}:{}", properties.bindAddress(), bound.getLocalPort());
  }

  @PreDestroy
  public void stop() {
    running = false;
    DatagramSocket current = socket;
    if (current != null) {
      current.close();
    }
    if (worker != null) {
      try {
        worker.join(RECEIVE_TIMEOUT_MS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
    log.info("UDP receiver stopped");
  }

  /** Local port actually bound, useful when configured with port 0. */
  public int localPort() {
    DatagramSocket current = socket;
    return current == null ? -1 : current.getLocalPort();
  }

  private void receiveLoop() {
    byte[] buffer = new byte[Math.max(512, properties.bufferSize())];
    while (running) {
      DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
      try {
        socket.receive(packet);
        log.debug("Received {} bytes from {}", packet.getLength(), packet.getSocketAddress());
        handle(packet.getData(), packet.getLength(), Instant.now());
      } catch (SocketTimeoutException ex) {
        continue;
      } catch (SocketException ex) {
        if (running) {
          log.error("Socket error in UDP receiver", ex);
        }
        return;
      } catch (IOException ex) {
        log.warn("UDP receive failed", ex);
      } catch (RuntimeException ex) {
        log.error("Unexpected error handling UDP packet", ex);
      }
    }
  }

  /**
   * Parses one datagram and forwards it unless it repeats a recent callsign.
   *
   * @return true when the contact was handed to the backend client
   */
  boolean handle(byte[] data, int length, Instant now) {
    Optional<LoggedContact> parsed = parser.parse(data, length);
    if (parsed.isEmpty()) {
      unparsedCounter.increment();
      log.debug("Could not parse {}-byte packet", length);
      return false;
    }
    receivedCounter.increment();
    LoggedContact contact = parsed.get();

    Instant previous = lastForwarded.get(contact.callsign());
    if (previous != null && now.isBefore(previous.plus(dedupeWindow))) {
      duplicateCounter.increment();
      log.debug("Ignoring repeat of {} within {}", contact.callsign(), dedupeWindow);
      return false;
    }
    lastForwarded.put(contact.callsign(), now);
    lastForwarded.values().removeIf(seen -> now.isAfter(seen.plus(dedupeWindow)));

    log.info("Logged contact {} ({})", contact.callsign(), contact.format());
    backendClient.forward(contact);
    return true;
  }
}
