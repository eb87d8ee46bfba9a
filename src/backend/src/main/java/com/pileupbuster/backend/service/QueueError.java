package com.pileupbuster.backend.service;

/** Domain failure codes raised by {@link QueueCoordinator}. */
public enum QueueError {
  INVALID_FORMAT("invalid_format"),
  DUPLICATE_CALLSIGN("duplicate_callsign"),
  QUEUE_FULL("queue_full"),
  SYSTEM_INACTIVE("system_inactive"),
  NOT_FOUND("not_found"),
  CONTACT_IN_PROGRESS("contact_in_progress"),
  NOTHING_ACTIVE("nothing_active"),
  UNAUTHORIZED("unauthorized");

  private final String code;

  QueueError(String code) {
    this.code = code;
  }

  /** Stable machine-readable code used in error payloads and metric tags. */
  public String code() {
    return code;
  }
}
