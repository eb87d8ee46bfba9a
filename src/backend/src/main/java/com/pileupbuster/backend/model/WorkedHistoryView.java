package com.pileupbuster.backend.model;

import java.util.List;

/**
 * Payload of {@code worked_callers_update} events.
 *
 * @param workedCallers unexpired records, most recent first
 * @param total number of records
 */
public record WorkedHistoryView(List<WorkedRecord> workedCallers, int total) {}
