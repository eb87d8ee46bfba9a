package com.pileupbuster.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a contact entered the active slot. */
public enum ContactOrigin {
  FROM_QUEUE("from-queue"),
  DIRECT_START("direct-start");

  private final String wireName;

  ContactOrigin(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
