package com.pileupbuster.backend.rate;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class InMemoryRateLimiterTest {

  @Test
  void allow_rejectsOnceWindowIsFullAndRecoversAfterWindow() {
    InMemoryRateLimiter limiter = new InMemoryRateLimiter();

    assertTrue(limiter.allow("10.0.0.1", 60, 2, 1_000L));
    assertTrue(limiter.allow("10.0.0.1", 60, 2, 1_010L));
    assertFalse(limiter.allow("10.0.0.1", 60, 2, 1_020L));
    assertTrue(limiter.allow("10.0.0.2", 60, 2, 1_020L));
    assertTrue(limiter.allow("10.0.0.1", 60, 2, 1_061L));
  }
}
