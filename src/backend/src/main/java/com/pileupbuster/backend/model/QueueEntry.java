package com.pileupbuster.backend.model;

import java.time.Instant;

/**
 * One registration in the waiting line, as persisted.
 *
 * @param callsign normalized uppercase callsign
 * @param joinedAt registration time, defines FIFO order
 * @param profile lookup result, null until resolved
 */
public record QueueEntry(String callsign, Instant joinedAt, CallsignProfile profile) {

  public QueueEntry withProfile(CallsignProfile newProfile) {
    return new QueueEntry(callsign, joinedAt, newProfile);
  }
}
