package com.waterly.store.telemetry.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.waterly.store.error.ValidationException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Closed interval {@code [from, to]} of forecast hours.
 */
public record TimeWindow(Instant from, Instant to) {

  public TimeWindow {
    ValidationException.requirePresent("from", from);
    ValidationException.requirePresent("to", to);
    if (from.isAfter(to)) {
      throw new ValidationException("from", "must not be after to");
    }
  }

  public static TimeWindow around(Instant now, Duration before, Duration after) {
    ValidationException.requirePresent("now", now);
    ValidationException.requirePresent("before", before);
    ValidationException.requirePresent("after", after);
    if (before.isNegative()) {
      throw new ValidationException("before", "must not be negative, got " + before);
    }
    if (after.isNegative()) {
      throw new ValidationException("after", "must not be negative, got " + after);
    }
    return new TimeWindow(shift(now, before.negated(), "before"), shift(now, after, "after"));
  }

  private static Instant shift(Instant now, Duration by, String field) {
    try {
      return now.plus(by);
    } catch (DateTimeException | ArithmeticException ex) {
      throw new ValidationException(field, "reaches outside the supported time range", ex);
    }
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(from) && !instant.isAfter(to);
  }

  @JsonProperty("span_seconds")
  public long spanSeconds() {
    return Duration.between(from, to).getSeconds();
  }
}
