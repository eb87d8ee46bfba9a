package com.pileupbuster.backend.model;

/**
 * Outcome of a direct start.
 *
 * @param contact the newly installed contact
 * @param wasInQueue whether the callsign was removed from the queue
 * @param interrupted previous contact archived as interrupted, or null
 */
public record DirectStartResult(CurrentContact contact, boolean wasInQueue, WorkedRecord interrupted) {}
