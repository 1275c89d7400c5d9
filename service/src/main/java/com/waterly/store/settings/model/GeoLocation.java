package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GeoLocation(
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude
) {

  public GeoLocation {
    if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
      throw new IllegalArgumentException("latitude must be within -90..90, got " + latitude);
    }
    if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
      throw new IllegalArgumentException("longitude must be within -180..180, got " + longitude);
    }
  }
}
