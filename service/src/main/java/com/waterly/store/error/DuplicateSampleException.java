package com.waterly.store.error;

import java.time.Instant;

/**
 * A measurement for the same zone, metric and second was already recorded. The stored sample is
 * left untouched.
 */
public class DuplicateSampleException extends RuntimeException {
  private final String zone;
  private final String metric;
  private final Instant timestamp;

  public DuplicateSampleException(String zone, String metric, Instant timestamp, Throwable cause) {
    super("Duplicate sample for zone " + zone + ", metric " + metric + " at " + timestamp, cause);
    this.zone = zone;
    this.metric = metric;
    this.timestamp = timestamp;
  }

  public String zone() {
    return zone;
  }

  public String metric() {
    return metric;
  }

  public Instant timestamp() {
    return timestamp;
  }
}
