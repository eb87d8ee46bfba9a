package com.pileupbuster.backend.model;

import java.time.Instant;

/**
 * Operational switches and display strings.
 *
 * @param active whether the queue accepts registrations
 * @param frequencyDisplay operating frequency as shown to viewers
 * @param splitDisplay split information as shown to viewers
 * @param integrationEnabled whether started contacts are announced to logging software
 * @param updatedAt last modification time
 */
public record SystemSettings(
    boolean active,
    String frequencyDisplay,
    String splitDisplay,
    boolean integrationEnabled,
    Instant updatedAt) {

  public static SystemSettings defaults() {
    return new SystemSettings(false, null, null, false, null);
  }

  public SystemSettings withActive(boolean newActive, Instant now) {
    return new SystemSettings(newActive, frequencyDisplay, splitDisplay, integrationEnabled, now);
  }

  public SystemSettings withFrequency(String newFrequency, Instant now) {
    return new SystemSettings(active, newFrequency, splitDisplay, integrationEnabled, now);
  }

  public SystemSettings withSplit(String newSplit, Instant now) {
    return new SystemSettings(active, frequencyDisplay, newSplit, integrationEnabled, now);
  }

  public SystemSettings withIntegrationEnabled(boolean enabled, Instant now) {
    return new SystemSettings(active, frequencyDisplay, splitDisplay, enabled, now);
  }
}
