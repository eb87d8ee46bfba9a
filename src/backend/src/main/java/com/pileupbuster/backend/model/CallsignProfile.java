package com.pileupbuster.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Station metadata attached to a callsign once the lookup service answers.
 *
 * <p>A failed lookup still produces a profile: every field is null except {@code error}.
 *
 * @param name operator display name
 * @param address formatted mailing address
 * @param dxccName DXCC entity (country) name
 * @param imageUrl profile picture URL
 * @param grid Maidenhead locator and coordinates
 * @param error lookup failure description, null on success
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallsignProfile(
    String name,
    String address,
    String dxccName,
    String imageUrl,
    Grid grid,
    String error) {

  public static CallsignProfile failed(String error) {
    return new CallsignProfile(null, null, null, null, Grid.EMPTY, error);
  }

  public boolean hasError() {
    return error != null;
  }

  /**
   * Location block of a profile.
   *
   * @param latitude decimal degrees
   * @param longitude decimal degrees
   * @param locator Maidenhead grid square
   */
  public record Grid(Double latitude, Double longitude, String locator) {
    public static final Grid EMPTY = new Grid(null, null, null);
  }
}
