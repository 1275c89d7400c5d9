package com.waterly.store.telemetry.model;

import java.time.Instant;

public record LatestReading(String metric, String unit, double value, Instant timestamp,
    String timezone) {}
