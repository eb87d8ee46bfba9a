package com.pileupbuster.backend.model;

import java.time.Instant;

/**
 * Archived contact kept until {@code expiresAt}.
 *
 * @param callsign normalized callsign
 * @param completedAt archival time
 * @param expiresAt time after which the record is no longer visible
 * @param profile lookup result, may be null
 * @param origin how the contact had started
 * @param outcome completed normally or interrupted
 */
public record WorkedRecord(
    String callsign,
    Instant completedAt,
    Instant expiresAt,
    CallsignProfile profile,
    ContactOrigin origin,
    ContactOutcome outcome) {

  public boolean isLive(Instant now) {
    return expiresAt != null && expiresAt.isAfter(now);
  }

  public WorkedRecord withExpiresAt(Instant newExpiresAt) {
    return new WorkedRecord(callsign, completedAt, newExpiresAt, profile, origin, outcome);
  }
}
