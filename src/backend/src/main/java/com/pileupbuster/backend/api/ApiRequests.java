package com.pileupbuster.backend.api;

/** JSON request bodies accepted by the public and admin endpoints. */
public final class ApiRequests {
  private ApiRequests() {}

  public record RegisterRequest(String callsign) {}

  public record DirectStartRequest(String callsign, String frequency, String mode, String source) {}

  public record FrequencyRequest(String frequency) {}

  public record SplitRequest(String split) {}

  public record StatusRequest(Boolean active) {}

  public record IntegrationRequest(Boolean enabled) {}

  static <T> T require(T body, String message) {
    if (body == null) {
      throw new BadRequestException(message);
    }
    return body;
  }

  static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new BadRequestException(field + " is required");
    }
    return value;
  }
}
