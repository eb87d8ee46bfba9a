package com.pileupbuster.bridge.udp;

import com.pileupbuster.bridge.udp.LoggedContact.PacketFormat;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts a logged contact from a UDP datagram.
 *
 * <p>Formats are tried in order: WSJT-X binary (magic {@code 0xADBCCBDA} followed by an ADIF
 * payload), ADIF text, a bare callsign in plain text, and finally ADIF decoded as Latin-1.
 * Packets carrying the WSJT-X magic are only read as WSJT-X, so heartbeats and status frames
 * never fall through to the plain-text scan.
 */
@Component
public class LoggedContactParser {
  private static final Logger log = LoggerFactory.getLogger(LoggedContactParser.class);

  static final int WSJTX_MAGIC = 0xADBCCBDA;
  private static final int WSJTX_HEADER_BYTES = 12;

  private static final Pattern ADIF_CALL = Pattern.compile("<call:(\\d+)>([A-Z0-9/]+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern ADIF_FREQ = Pattern.compile("<freq:(\\d+)>([0-9.]+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern ADIF_MODE = Pattern.compile("<mode:(\\d+)>([A-Z0-9]+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern PLAIN_CALL = Pattern.compile("\\b[A-Z0-9]{1,3}[0-9][A-Z0-9]{0,3}[A-Z]\\b");
  private static final Set<String> FALSE_POSITIVES =
      Set.of("TEST", "DEMO", "EXAMPLE", "SAMPLE", "QSO", "LOG", "ADIF", "WSJT", "FT8", "FT4");

  public Optional<LoggedContact> parse(byte[] data, int length) {
    if (data == null || length <= 0) {
      return Optional.empty();
    }
    if (hasWsjtxMagic(data, length)) {
      String payload = new String(data, WSJTX_HEADER_BYTES, length - WSJTX_HEADER_BYTES, StandardCharsets.UTF_8);
      log.debug("WSJT-X packet: schema={}, type={}", readInt(data, 4), readInt(data, 8));
      return parseAdif(payload, PacketFormat.WSJTX_BINARY);
    }

    String utf8 = new String(data, 0, length, StandardCharsets.UTF_8);
    Optional<LoggedContact> contact = parseAdif(utf8, PacketFormat.ADIF);
    if (contact.isPresent()) {
      return contact;
    }
    contact = parsePlainText(utf8);
    if (contact.isPresent()) {
      return contact;
    }
    return parseAdif(new String(data, 0, length, StandardCharsets.ISO_8859_1), PacketFormat.ADIF_LATIN1);
  }

  Optional<LoggedContact> parseAdif(String text, PacketFormat format) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    Matcher call = ADIF_CALL.matcher(text);
    if (!call.find()) {
      return Optional.empty();
    }
    String callsign = call.group(2).trim().toUpperCase(Locale.ROOT);
    if (!isPlausibleCallsign(callsign)) {
      return Optional.empty();
    }

    Double frequency = null;
    Matcher freq = ADIF_FREQ.matcher(text);
    if (freq.find()) {
      try {
        frequency = Double.valueOf(freq.group(2));
      } catch (NumberFormatException ex) {
        log.debug("Ignoring unparsable ADIF frequency {}", freq.group(2));
      }
    }

    Matcher mode = ADIF_MODE.matcher(text);
    String modeValue = mode.find() ? mode.group(2).toUpperCase(Locale.ROOT) : null;
    return Optional.of(new LoggedContact(callsign, frequency, modeValue, format));
  }

  Optional<LoggedContact> parsePlainText(String text) {
    Matcher matcher = PLAIN_CALL.matcher(text.trim().toUpperCase(Locale.ROOT));
    while (matcher.find()) {
      String candidate = matcher.group();
      if (isPlausibleCallsign(candidate)) {
        return Optional.of(new LoggedContact(candidate, null, null, PacketFormat.PLAIN_TEXT));
      }
    }
    return Optional.empty();
  }

  static boolean isPlausibleCallsign(String callsign) {
    if (callsign == null || callsign.length() < 3 || callsign.length() > 10) {
      return false;
    }
    boolean hasDigit = false;
    boolean hasLetter = false;
    for (int i = 0; i < callsign.length(); i++) {
      char c = callsign.charAt(i);
      if (Character.isDigit(c)) {
        hasDigit = true;
      } else if (Character.isLetter(c)) {
        hasLetter = true;
      } else if (c != '/') {
        return false;
      }
    }
    return hasDigit && hasLetter && !FALSE_POSITIVES.contains(callsign);
  }

  private static boolean hasWsjtxMagic(byte[] data, int length) {
    return length >= WSJTX_HEADER_BYTES && readInt(data, 0) == WSJTX_MAGIC;
  }

  private static int readInt(byte[] data, int offset) {
    return ByteBuffer.wrap(data, offset, 4).getInt();
  }
}
