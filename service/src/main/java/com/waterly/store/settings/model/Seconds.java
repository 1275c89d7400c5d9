package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

public record Seconds(@JsonProperty("value") long value) {

  public Seconds {
    if (value <= 0) {
      throw new IllegalArgumentException("seconds must be positive, got " + value);
    }
  }

  public Duration toDuration() {
    return Duration.ofSeconds(value);
  }
}
