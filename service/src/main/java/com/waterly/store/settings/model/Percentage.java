package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Percentage(@JsonProperty("value") double value) {

  public Percentage {
    if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
      throw new IllegalArgumentException("percentage must be within 0..100, got " + value);
    }
  }
}
