package com.pileupbuster.backend.api;

import com.pileupbuster.backend.model.CurrentContact;

/** Small JSON envelopes returned where a bare domain value would be ambiguous. */
public final class ApiResponses {
  private ApiResponses() {}

  /** Active contact wrapper; {@code currentQso} is null when idle. */
  public record CurrentQsoResponse(String message, CurrentContact currentQso) {}

  /** Result of a bulk operation. */
  public record CountResponse(String message, int count) {}
}
