package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SampleCount(@JsonProperty("value") int value) {

  public SampleCount {
    if (value <= 0) {
      throw new IllegalArgumentException("sample count must be positive, got " + value);
    }
  }
}
