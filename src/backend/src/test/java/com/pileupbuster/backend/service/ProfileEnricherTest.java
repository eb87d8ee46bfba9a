package com.pileupbuster.backend.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.pileupbuster.backend.config.PileupProperties;
import com.pileupbuster.backend.model.CallsignProfile;
import com.pileupbuster.backend.qrz.CallsignLookup;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProfileEnricherTest {
  @Mock private CallsignLookup lookup;

  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void enrich_deliversLookupResultToCallback() throws Exception {
    CallsignProfile profile = new CallsignProfile("Hiram Maxim", null, "United States", null, null, null);
    when(lookup.lookup("W1AW")).thenReturn(profile);
    AtomicReference<CallsignProfile> received = new AtomicReference<>();

    new ProfileEnricher(lookup, new PileupProperties(), executor).enrich("W1AW", received::set);
    drain();

    assertEquals(profile, received.get());
  }

  @Test
  void enrich_turnsLookupExceptionIntoErrorProfile() throws Exception {
    when(lookup.lookup("W1AW")).thenThrow(new IllegalStateException("parser exploded"));
    AtomicReference<CallsignProfile> received = new AtomicReference<>();

    new ProfileEnricher(lookup, new PileupProperties(), executor).enrich("W1AW", received::set);
    drain();

    assertTrue(received.get().hasError());
    assertEquals("Lookup failed: parser exploded", received.get().error());
  }

  @Test
  void enrich_doesNothingWhenDisabled() throws Exception {
    PileupProperties properties = new PileupProperties();
    properties.getQrz().setEnabled(false);
    AtomicReference<CallsignProfile> received = new AtomicReference<>();

    new ProfileEnricher(lookup, properties, executor).enrich("W1AW", received::set);
    drain();

    assertNull(received.get());
    verifyNoInteractions(lookup);
  }

  private void drain() throws InterruptedException {
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
  }
}
