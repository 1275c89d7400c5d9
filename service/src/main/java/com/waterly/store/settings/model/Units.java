package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Units(@JsonProperty("value") UnitSystem value) {

  public Units {
    if (value == null) {
      throw new IllegalArgumentException("unit system is required");
    }
  }
}
