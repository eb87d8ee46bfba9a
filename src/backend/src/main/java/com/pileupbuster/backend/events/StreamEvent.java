package com.pileupbuster.backend.events;

import java.time.Instant;

/**
 * Envelope written to the wire as {@code {type, data, timestamp}}.
 *
 * @param type event type
 * @param data event payload, may be null (for example an idle {@code current_qso})
 * @param timestamp publish time
 */
public record StreamEvent(EventType type, Object data, Instant timestamp) {}
