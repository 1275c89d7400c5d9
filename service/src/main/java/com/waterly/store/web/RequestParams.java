package com.waterly.store.web;

import java.time.Duration;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Parsing of query and path parameters shared by the controllers. Instants are accepted either as
 * ISO-8601 ({@code 2024-05-01T12:00:00Z}) or as epoch seconds; durations as ISO-8601
 * ({@code PT12H}).
 */
public final class RequestParams {
  public static final String ERROR_DOCS_BASE = "https://docs.waterly.dev/errors/";

  static final int INVALID_INSTANT = 1001;
  static final int INVALID_DURATION = 1002;
  static final int INVALID_COUNT = 1003;

  private RequestParams() {
  }

  public static Instant instant(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidParameterException("Parameter '" + name + "' is required", INVALID_INSTANT,
          ERROR_DOCS_BASE + "invalid-instant");
    }
    String value = raw.trim();
    if (value.chars().allMatch(Character::isDigit)) {
      try {
        return Instant.ofEpochSecond(Long.parseLong(value));
      } catch (NumberFormatException | DateTimeException ex) {
        throw invalidInstant(name, raw);
      }
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeException ex) {
      throw invalidInstant(name, raw);
    }
  }

  public static Instant instantOrDefault(String name, String raw, Instant fallback) {
    return raw == null || raw.isBlank() ? fallback : instant(name, raw);
  }

  public static Duration durationOrDefault(String name, String raw, Duration fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Duration.parse(raw.trim());
    } catch (DateTimeParseException ex) {
      throw new InvalidParameterException("Parameter '" + name + "' must be an ISO-8601 duration"
          + " such as PT12H, got '" + raw + "'", INVALID_DURATION,
          ERROR_DOCS_BASE + "invalid-duration");
    }
  }

  public static int count(String name, int value, int max) {
    if (Math.abs((long) value) > max) {
      throw new InvalidParameterException("Parameter '" + name + "' must be within -" + max
          + ".." + max + ", got " + value, INVALID_COUNT, ERROR_DOCS_BASE + "invalid-count");
    }
    return value;
  }

  private static InvalidParameterException invalidInstant(String name, String raw) {
    return new InvalidParameterException("Parameter '" + name + "' must be an ISO-8601 instant or"
        + " epoch seconds, got '" + raw + "'", INVALID_INSTANT, ERROR_DOCS_BASE + "invalid-instant");
  }
}
