package com.pileupbuster.backend.qrz;

import com.pileupbuster.backend.model.CallsignProfile;

/** Source of station metadata for a callsign. */
public interface CallsignLookup {

  /**
   * Resolves a callsign.
   *
   * <p>Implementations never throw for upstream failures; they return
   * {@link CallsignProfile#failed(String)} instead.
   *
   * @param callsign normalized callsign
   * @return resolved or error profile
   */
  CallsignProfile lookup(String callsign);
}
