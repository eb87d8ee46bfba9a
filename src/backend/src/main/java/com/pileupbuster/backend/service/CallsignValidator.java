package com.pileupbuster.backend.service;

import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Normalizes and validates amateur-radio callsigns.
 *
 * <p>Accepted shapes follow the ITU allocation: a one or two letter prefix, one or two digits and
 * a one to four letter suffix (e.g. {@code W1AW}, {@code EA4ABC}), or a digit-letter-digit prefix
 * with a one to three letter suffix (e.g. {@code 2E0ABC}).
 */
@Component
public class CallsignValidator {
  private static final Pattern CALLSIGN =
      Pattern.compile("^([A-Z]{1,2}[0-9]{1,2}[A-Z]{1,4}|[0-9][A-Z][0-9][A-Z]{1,3})$");

  /**
   * Trims and upper-cases a raw callsign without validating it.
   *
   * @param raw user input, may be null
   * @return canonical form, empty string for null input
   */
  public String canonicalize(String raw) {
    if (raw == null) {
      return "";
    }
    return raw.trim().toUpperCase(Locale.ROOT);
  }

  public boolean isValid(String raw) {
    return CALLSIGN.matcher(canonicalize(raw)).matches();
  }

  /**
   * Returns the canonical callsign or rejects it.
   *
   * @param raw user input
   * @return trimmed upper-case callsign
   * @throws QueueOperationException with {@link QueueError#INVALID_FORMAT} when the shape is wrong
   */
  public String normalize(String raw) {
    String callsign = canonicalize(raw);
    if (!CALLSIGN.matcher(callsign).matches()) {
      throw new QueueOperationException(
          QueueError.INVALID_FORMAT, "Invalid callsign format: '" + callsign + "'");
    }
    return callsign;
  }
}
