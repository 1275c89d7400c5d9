package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum UnitSystem {
  METRIC,
  IMPERIAL;

  @JsonCreator
  public static UnitSystem fromJson(String value) {
    if (value != null) {
      for (UnitSystem system : values()) {
        if (system.name().equalsIgnoreCase(value.trim())) {
          return system;
        }
      }
    }
    throw new IllegalArgumentException("unit system must be metric or imperial, got " + value);
  }

  @JsonValue
  public String toJson() {
    return name().toLowerCase(Locale.ROOT);
  }
}
