package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Yearly active period, both ends inclusive, as {@code MM-dd}. A stop before the start wraps
 * around the new year.
 */
public record Season(@JsonProperty("start") String start, @JsonProperty("stop") String stop) {
  private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("MM-dd");

  public Season {
    parse("start", start);
    parse("stop", stop);
  }

  public boolean contains(MonthDay day) {
    MonthDay from = parse("start", start);
    MonthDay to = parse("stop", stop);
    if (!from.isAfter(to)) {
      return !day.isBefore(from) && !day.isAfter(to);
    }
    return !day.isBefore(from) || !day.isAfter(to);
  }

  private static MonthDay parse(String field, String value) {
    if (value == null) {
      throw new IllegalArgumentException(field + " is required");
    }
    try {
      return MonthDay.parse(value, FORMAT);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(field + " '" + value + "' is not a MM-dd day");
    }
  }
}
