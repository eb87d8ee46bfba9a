package com.pileupbuster.backend.model;

import java.time.Instant;

/**
 * Queue entry decorated with its derived rank.
 *
 * @param callsign normalized callsign
 * @param joinedAt registration time
 * @param position 1-based rank, recomputed on every read
 * @param waitSeconds seconds spent in the queue at read time
 * @param profile lookup result, may be null
 */
public record QueuePosition(
    String callsign,
    Instant joinedAt,
    int position,
    long waitSeconds,
    CallsignProfile profile) {}
