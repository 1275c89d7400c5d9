package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** An ISO calendar date, or null when the event never happened. */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record CalendarDate(@JsonProperty("value") String value) {

  public static final CalendarDate NEVER = new CalendarDate(null);

  public CalendarDate {
    if (value != null) {
      try {
        LocalDate.parse(value);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException("'" + value + "' is not a yyyy-MM-dd date");
      }
    }
  }

  public static CalendarDate of(LocalDate date) {
    return new CalendarDate(date == null ? null : date.toString());
  }

  public Optional<LocalDate> toLocalDate() {
    return Optional.ofNullable(value).map(LocalDate::parse);
  }
}
