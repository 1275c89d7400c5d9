package com.waterly.store.telemetry.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.waterly.store.error.ValidationException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One scalar sensor reading. Immutable once recorded; the timestamp is kept at second resolution
 * and, together with zone and metric, identifies the sample.
 */
public record Measurement(
    Long id,
    String zone,
    String metric,
    String unit,
    Instant timestamp,
    String timezone,
    double value,
    @JsonProperty("created_at") Instant createdAt
) {

  public Measurement {
    ValidationException.requireText("zone", zone);
    ValidationException.requireText("metric", metric);
    ValidationException.requirePresent("unit", unit);
    ValidationException.requirePresent("timestamp", timestamp);
    if (!Double.isFinite(value)) {
      throw new ValidationException("value", "must be a finite number, got " + value);
    }
    timestamp = timestamp.truncatedTo(ChronoUnit.SECONDS);
  }

  public static Measurement of(String zone, String metric, String unit, Instant timestamp,
      String timezone, double value) {
    return new Measurement(null, zone, metric, unit, timestamp, timezone, value, null);
  }
}
