package com.pileupbuster.backend.service;

import com.pileupbuster.backend.config.PileupProperties;
import com.pileupbuster.backend.model.CallsignProfile;
import com.pileupbuster.backend.qrz.CallsignLookup;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs callsign lookups off the request path and hands results back to the caller.
 */
@Service
public class ProfileEnricher {
  private static final Logger log = LoggerFactory.getLogger(ProfileEnricher.class);

  private final CallsignLookup lookup;
  private final boolean enabled;
  private final ExecutorService executor;

  @Autowired
  public ProfileEnricher(CallsignLookup lookup, PileupProperties properties) {
    this(lookup, properties, newLookupPool(properties.getQrz().getLookupThreads()));
  }

  ProfileEnricher(CallsignLookup lookup, PileupProperties properties, ExecutorService executor) {
    this.lookup = lookup;
    this.enabled = properties.getQrz().isEnabled();
    this.executor = executor;
  }

  /**
   * Schedules a lookup; {@code onResolved} runs on the lookup thread once a profile is available.
   *
   * @param callsign normalized callsign
   * @param onResolved receiver of the resolved or error profile
   */
  public void enrich(String callsign, Consumer<CallsignProfile> onResolved) {
    if (!enabled) {
      return;
    }
    try {
      executor.execute(() -> resolve(callsign, onResolved));
    } catch (RejectedExecutionException ex) {
      log.warn("Profile lookup for {} rejected: executor is shut down", callsign);
    }
  }

  private void resolve(String callsign, Consumer<CallsignProfile> onResolved) {
    CallsignProfile profile;
    try {
      profile = lookup.lookup(callsign);
    } catch (RuntimeException ex) {
      log.warn("Profile lookup for {} failed", callsign, ex);
      profile = CallsignProfile.failed("Lookup failed: " + ex.getMessage());
    }
    try {
      onResolved.accept(profile);
    } catch (RuntimeException ex) {
      log.error("Unable to store profile for {}", callsign, ex);
    }
  }

  @PreDestroy
  public void shutdown() {
    executor.shutdownNow();
  }

  private static ExecutorService newLookupPool(int threads) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(Math.max(1, threads), runnable -> {
      Thread thread = new Thread(runnable, "pileup-profile-lookup-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }
}
