package com.waterly.store.telemetry.model;

/**
 * A forecast value with the unit it was reported in. Units travel as opaque strings; no
 * conversion happens in the store.
 */
public record Quantity(Double value, String unit) {

  public static final Quantity NONE = new Quantity(null, null);

  public static Quantity of(double value, String unit) {
    return new Quantity(value, unit);
  }
}
