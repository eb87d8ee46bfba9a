package com.pileupbuster.bridge.udp;

/**
 * Contact reported by logging software.
 *
 * @param callsign uppercase callsign as logged
 * @param frequencyMhz dial frequency in MHz, null when the packet carried none
 * @param mode operating mode, null when absent
 * @param format packet format the contact was decoded from
 */
public record LoggedContact(String callsign, Double frequencyMhz, String mode, PacketFormat format) {

  /** Wire formats understood by {@link LoggedContactParser}. */
  public enum PacketFormat {
    WSJTX_BINARY,
    ADIF,
    PLAIN_TEXT,
    ADIF_LATIN1
  }
}
