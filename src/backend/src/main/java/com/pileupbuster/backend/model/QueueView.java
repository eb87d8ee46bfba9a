package com.pileupbuster.backend.model;

import java.util.List;

/**
 * Payload of {@code queue_update} events and {@code GET /api/queue/list}.
 *
 * @param queue entries in FIFO order with contiguous positions
 * @param total number of entries
 * @param maxSize configured capacity
 * @param systemActive whether registrations are currently accepted
 */
public record QueueView(List<QueuePosition> queue, int total, int maxSize, boolean systemActive) {}
