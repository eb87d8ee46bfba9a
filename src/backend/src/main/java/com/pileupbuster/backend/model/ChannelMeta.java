package com.pileupbuster.backend.model;

/**
 * Opaque operating tags reported with a direct start.
 *
 * @param frequency display frequency, e.g. {@code 14.230}
 * @param mode operating mode, e.g. {@code SSB}
 * @param source reporter identifier, e.g. {@code bridge}
 */
public record ChannelMeta(String frequency, String mode, String source) {
  public static final ChannelMeta NONE = new ChannelMeta(null, null, null);
}
