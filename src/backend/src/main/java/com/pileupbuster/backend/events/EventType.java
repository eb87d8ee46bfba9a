package com.pileupbuster.backend.events;

import com.fasterxml.jackson.annotation.JsonValue;

/** Typed change notifications delivered to stream viewers. */
public enum EventType {
  CONNECTED("connected", true),
  QUEUE_UPDATE("queue_update", true),
  CURRENT_QSO("current_qso", true),
  SYSTEM_STATUS("system_status", true),
  FREQUENCY_UPDATE("frequency_update", true),
  SPLIT_UPDATE("split_update", true),
  WORKED_CALLERS_UPDATE("worked_callers_update", true),
  KEEPALIVE("keepalive", false);

  private final String wireName;
  private final boolean critical;

  EventType(String wireName, boolean critical) {
    this.wireName = wireName;
    this.critical = critical;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Non-critical events may be dropped for a lagging subscriber. */
  public boolean isCritical() {
    return critical;
  }
}
