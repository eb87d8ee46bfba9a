package com.pileupbuster.backend.auth;

import com.pileupbuster.backend.config.PileupProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import org.springframework.stereotype.Component;

/**
 * Checks HTTP Basic credentials against the configured admin account.
 *
 * <p>Comparisons run in constant time.
 */
@Component
public class AdminCredentialsVerifier {
  private static final String BASIC_PREFIX = "Basic ";

  private final PileupProperties.Admin admin;

  public AdminCredentialsVerifier(PileupProperties properties) {
    this.admin = properties.getAdmin();
  }

  /** Returns whether an admin account has been configured at all. */
  public boolean isConfigured() {
    return !isBlank(admin.getUsername()) && !isBlank(admin.getPassword());
  }

  /**
   * Verifies an {@code Authorization} header value.
   *
   * @param authorizationHeader raw header, may be null
   * @return {@code true} when the header carries the configured credentials
   */
  public boolean isAuthorized(String authorizationHeader) {
    if (!isConfigured() || authorizationHeader == null
        || !authorizationHeader.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
      return false;
    }

    String decoded;
    try {
      byte[] bytes = Base64.getDecoder().decode(authorizationHeader.substring(BASIC_PREFIX.length()).trim());
      decoded = new String(bytes, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      return false;
    }

    int separator = decoded.indexOf(':');
    if (separator < 0) {
      return false;
    }
    boolean userMatches = constantTimeEquals(decoded.substring(0, separator), admin.getUsername());
    boolean passwordMatches = constantTimeEquals(decoded.substring(separator + 1), admin.getPassword());
    return userMatches & passwordMatches;
  }

  private static boolean constantTimeEquals(String provided, String expected) {
    return MessageDigest.isEqual(
        provided.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
