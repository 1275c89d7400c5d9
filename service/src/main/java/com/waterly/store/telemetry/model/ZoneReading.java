package com.waterly.store.telemetry.model;

/**
 * One row of the latest-by-zone view. {@code reading} is null for a zone with no measurements.
 */
public record ZoneReading(String zone, LatestReading reading) {}
