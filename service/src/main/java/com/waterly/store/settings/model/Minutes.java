package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Minutes(@JsonProperty("value") int value) {

  public Minutes {
    if (value <= 0) {
      throw new IllegalArgumentException("minutes must be positive, got " + value);
    }
  }
}
