package com.pileupbuster.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why a contact left the active slot and was archived. */
public enum ContactOutcome {
  COMPLETED("completed"),
  INTERRUPTED("interrupted");

  private final String wireName;

  ContactOutcome(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
