package com.pileupbuster.backend.integration;

import com.pileupbuster.backend.config.PileupProperties;
import com.pileupbuster.backend.model.CurrentContact;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Announces started contacts to station logging software using the WSJT-X UDP protocol.
 *
 * <p>Each announcement is one "Logged ADIF" datagram (message type 5): magic number, schema
 * version, message type, application id and an ADIF record, all big-endian with strings encoded
 * as a 32-bit length followed by UTF-8 bytes. Send failures are logged and never propagated.
 */
@Service
public class LoggerIntegrationService {
  private static final Logger log = LoggerFactory.getLogger(LoggerIntegrationService.class);

  static final int MAGIC = 0xADBCCBDA;
  static final int SCHEMA_VERSION = 2;
  static final int LOGGED_ADIF = 5;

  private static final DateTimeFormatter QSO_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter TIME_ON = DateTimeFormatter.ofPattern("HHmmss").withZone(ZoneOffset.UTC);
  private static final Pattern NUMBER = Pattern.compile("(\\d+(?:[.,]\\d+)?)");

  private final PileupProperties.LoggerIntegration properties;
  private final Counter sentCounter;
  private final Counter failedCounter;

  public LoggerIntegrationService(PileupProperties properties, MeterRegistry meterRegistry) {
    this.properties = properties.getLoggerIntegration();
    this.sentCounter = meterRegistry.counter("pileup.logger.announcements.total", "outcome", "sent");
    this.failedCounter = meterRegistry.counter("pileup.logger.announcements.total", "outcome", "failed");
  }

  /**
   * Sends one "Logged ADIF" datagram for the contact.
   *
   * @param contact contact that just started
   * @param frequencyDisplay operator frequency display string, may be null or free-form
   */
  public void announce(CurrentContact contact, String frequencyDisplay) {
    try (DatagramSocket socket = new DatagramSocket()) {
      byte[] packet = buildPacket(contact.callsign(), contact.startedAt(), frequencyDisplay);
      InetAddress target = InetAddress.getByName(properties.getHost());
      socket.send(new DatagramPacket(packet, packet.length, target, properties.getPort()));
      sentCounter.increment();
      log.info("Announced {} to logger at {}:{}", contact.callsign(), properties.getHost(), properties.getPort());
    } catch (IOException | RuntimeException ex) {
      failedCounter.increment();
      log.warn("Failed to announce {} to logger at {}:{}", contact.callsign(), properties.getHost(),
          properties.getPort(), ex);
    }
  }

  byte[] buildPacket(String callsign, Instant startedAt, String frequencyDisplay) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(buffer)) {
      out.writeInt(MAGIC);
      out.writeInt(SCHEMA_VERSION);
      out.writeInt(LOGGED_ADIF);
      writeString(out, properties.getAppName());
      writeString(out, adifRecord(callsign, startedAt, frequencyDisplay));
    }
    return buffer.toByteArray();
  }

  String adifRecord(String callsign, Instant startedAt, String frequencyDisplay) {
    Instant at = startedAt == null ? Instant.now() : startedAt;
    StringBuilder adif = new StringBuilder();
    field(adif, "call", callsign);
    field(adif, "qso_date", QSO_DATE.format(at));
    field(adif, "time_on", TIME_ON.format(at));
    field(adif, "mode", properties.getDefaultMode());
    field(adif, "rst_sent", "59");
    field(adif, "rst_rcvd", "59");
    String freq = toMegahertz(frequencyDisplay);
    if (freq != null) {
      field(adif, "freq", freq);
    }
    adif.append("<eor>");
    return adif.toString();
  }

  /**
   * Interprets a free-form display string as a frequency in MHz.
   *
   * <p>Values above 1,000,000 are read as Hz, above 1,000 as kHz, anything else as MHz.
   *
   * @return six-decimal MHz string, or null when no number can be found
   */
  static String toMegahertz(String frequencyDisplay) {
    if (frequencyDisplay == null) {
      return null;
    }
    Matcher matcher = NUMBER.matcher(frequencyDisplay);
    if (!matcher.find()) {
      return null;
    }
    double value = Double.parseDouble(matcher.group(1).replace(',', '.'));
    if (value <= 0) {
      return null;
    }
    double mhz;
    if (value >= 1_000_000) {
      mhz = value / 1_000_000;
    } else if (value >= 1_000) {
      mhz = value / 1_000;
    } else {
      mhz = value;
    }
    return String.format(Locale.ROOT, "%.6f", mhz);
  }

  private static void field(StringBuilder adif, String name, String value) {
    adif.append('<').append(name).append(':').append(value.length()).append('>').append(value).append(' ');
  }

  private static void writeString(DataOutputStream out, String value) throws IOException {
    byte[] bytes = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
    out.writeInt(bytes.length);
    out.write(bytes);
  }
}
