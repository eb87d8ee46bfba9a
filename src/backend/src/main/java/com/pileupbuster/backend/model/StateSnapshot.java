package com.pileupbuster.backend.model;

/**
 * Consistent read of every aggregate, served to clients after (re)connecting.
 *
 * @param queue queue view
 * @param currentQso active contact or null
 * @param status activation and integration flags
 * @param frequency frequency display string or null
 * @param split split display string or null
 * @param worked unexpired worked history
 */
public record StateSnapshot(
    QueueView queue,
    CurrentContact currentQso,
    SystemStatus status,
    String frequency,
    String split,
    WorkedHistoryView worked) {}
