package com.pileupbuster.backend.model;

import java.time.Instant;

/**
 * Payload of {@code frequency_update} and {@code split_update} events.
 *
 * @param value display string, null when cleared
 * @param updatedAt change time
 */
public record DisplayUpdate(String value, Instant updatedAt) {}
