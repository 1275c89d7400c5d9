package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Per-zone percentage, e.g. {@code {"Z1": 70.0, "Z2": 65.0}}. Every value lies in 0..100.
 */
public final class ZonePercentages {
  private final Map<String, Double> byZone;

  private ZonePercentages(Map<String, Double> byZone) {
    this.byZone = byZone;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ZonePercentages of(Map<String, Double> values) {
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("at least one zone is required");
    }
    Map<String, Double> copy = new TreeMap<>();
    values.forEach((zone, percent) -> {
      if (zone == null || zone.isBlank()) {
        throw new IllegalArgumentException("zone name must not be blank");
      }
      if (percent == null || percent.isNaN() || percent < 0.0 || percent > 100.0) {
        throw new IllegalArgumentException("percentage for " + zone + " must be within 0..100, got "
            + percent);
      }
      copy.put(zone, percent);
    });
    return new ZonePercentages(Collections.unmodifiableMap(copy));
  }

  public static ZonePercentages uniform(double percent, String... zones) {
    Map<String, Double> values = new TreeMap<>();
    for (String zone : zones) {
      values.put(zone, percent);
    }
    return of(values);
  }

  @JsonValue
  public Map<String, Double> asMap() {
    return byZone;
  }

  public Double forZone(String zone) {
    return byZone.get(zone);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ZonePercentages other)) {
      return false;
    }
    return byZone.equals(other.byZone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(byZone);
  }

  @Override
  public String toString() {
    return byZone.toString();
  }
}
