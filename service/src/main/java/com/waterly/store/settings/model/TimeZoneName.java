package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.DateTimeException;
import java.time.ZoneId;

/** IANA zone identifier such as {@code America/Chicago}. */
public record TimeZoneName(@JsonProperty("value") String value) {

  public TimeZoneName {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("time zone is required");
    }
    try {
      ZoneId.of(value);
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("unknown time zone '" + value + "'");
    }
  }

  public ZoneId toZoneId() {
    return ZoneId.of(value);
  }
}
