package com.waterly.store.telemetry.model;

import java.util.Map;

/**
 * Current state of a zone: the latest reading of every metric observed for it, keyed by metric
 * name. Empty for a zone that has never reported.
 */
public record ZoneSnapshot(String zone, Map<String, LatestReading> metrics) {}
