package com.pileupbuster.backend.model;

import java.time.Instant;

/**
 * Payload of {@code system_status} events and {@code GET /api/public/status}.
 *
 * @param active whether the queue accepts registrations
 * @param integrationEnabled whether logging-software integration is on
 * @param updatedAt last settings change
 */
public record SystemStatus(boolean active, boolean integrationEnabled, Instant updatedAt) {

  public static SystemStatus of(SystemSettings settings) {
    return new SystemStatus(settings.active(), settings.integrationEnabled(), settings.updatedAt());
  }
}
