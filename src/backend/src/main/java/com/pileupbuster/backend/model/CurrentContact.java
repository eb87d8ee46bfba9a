package com.pileupbuster.backend.model;

import java.time.Instant;

/**
 * The contact being worked right now.
 *
 * @param callsign normalized callsign
 * @param startedAt time the contact entered the slot
 * @param profile lookup result, may be null
 * @param origin queue promotion or direct start
 * @param channelMeta optional frequency/mode tags
 */
public record CurrentContact(
    String callsign,
    Instant startedAt,
    CallsignProfile profile,
    ContactOrigin origin,
    ChannelMeta channelMeta) {

  public CurrentContact withProfile(CallsignProfile newProfile) {
    return new CurrentContact(callsign, startedAt, newProfile, origin, channelMeta);
  }

  public CurrentContact withChannelMeta(ChannelMeta newChannelMeta) {
    return new CurrentContact(callsign, startedAt, profile, origin, newChannelMeta);
  }
}
