package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Local wall-clock time of day, {@code HH:mm}. */
public record ClockTime(@JsonProperty("value") String value) {
  private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("HH:mm");

  public ClockTime {
    if (value == null) {
      throw new IllegalArgumentException("time of day is required");
    }
    try {
      LocalTime.parse(value, FORMAT);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("'" + value + "' is not a HH:mm time of day");
    }
  }

  public LocalTime toLocalTime() {
    return LocalTime.parse(value, FORMAT);
  }
}
