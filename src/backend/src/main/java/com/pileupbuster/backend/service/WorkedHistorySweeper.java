package com.pileupbuster.backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically purges worked records past their expiry. */
@Component
public class WorkedHistorySweeper {
  private static final Logger log = LoggerFactory.getLogger(WorkedHistorySweeper.class);

  private final QueueCoordinator coordinator;

  public WorkedHistorySweeper(QueueCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @Scheduled(
      fixedDelayString = "${pileup.worked.sweep-interval:PT1M}",
      initialDelayString = "${pileup.worked.sweep-interval:PT1M}")
  public void sweep() {
    try {
      int removed = coordinator.sweepExpiredWorked();
      if (removed > 0) {
        log.info("Purged {} expired worked records", removed);
      }
    } catch (RuntimeException ex) {
      log.warn("Worked history sweep failed", ex);
    }
  }
}
