package com.waterly.store.telemetry.service;

import com.waterly.store.error.ValidationException;
import com.waterly.store.telemetry.model.LatestReading;
import com.waterly.store.telemetry.model.Measurement;
import com.waterly.store.telemetry.model.Weather;
import com.waterly.store.telemetry.model.ZoneReading;
import com.waterly.store.telemetry.model.ZoneSnapshot;
import com.waterly.store.telemetry.repository.MeasurementDao;
import com.waterly.store.telemetry.repository.WeatherDao;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Service;

/**
 * Answers "most recent" questions. Measurements resolve by timestamp per (zone, metric); weather
 * resolves by collection time per forecast hour, later insert winning a tie. Missing data yields
 * empty results.
 */
@Service
@DependsOn("migrationRunner")
public class LatestValueResolver {

  private final MeasurementDao measurements;
  private final WeatherDao weather;

  public LatestValueResolver(MeasurementDao measurements, WeatherDao weather) {
    this.measurements = measurements;
    this.weather = weather;
  }

  public Optional<Measurement> latestMeasurement(String zone, String metric) {
    ValidationException.requireText("zone", zone);
    ValidationException.requireText("metric", metric);
    return measurements.findLatest(zone, metric);
  }

  public List<Measurement> latestMeasurements() {
    return measurements.findLatestAll();
  }

  public List<ZoneSnapshot> latestByZone() {
    return toSnapshots(measurements.findLatestByZone());
  }

  public Optional<Weather> latestWeather(Instant forecastHour) {
    ValidationException.requirePresent("forecastHour", forecastHour);
    return weather.findLatest(forecastHour);
  }

  public List<Weather> latestWeather() {
    return weather.findLatestAll();
  }

  public List<Weather> latestWeatherBetween(Instant from, Instant to) {
    ValidationException.requirePresent("from", from);
    ValidationException.requirePresent("to", to);
    if (from.isAfter(to)) {
      return List.of();
    }
    return weather.findLatestBetween(from, to);
  }

  List<Weather> latestForecastsAfter(Instant from, int limit) {
    return weather.findLatestForecastsAfter(from, limit);
  }

  List<Weather> latestForecastsBefore(Instant from, int limit) {
    return weather.findLatestForecastsBefore(from, limit);
  }

  /**
   * Folds view rows into one snapshot per zone, ordered by zone name. A row without a reading
   * contributes the zone only.
   */
  static List<ZoneSnapshot> toSnapshots(List<ZoneReading> rows) {
    Map<String, Map<String, LatestReading>> byZone = new TreeMap<>();
    for (ZoneReading row : rows) {
      Map<String, LatestReading> metrics =
          byZone.computeIfAbsent(row.zone(), zone -> new LinkedHashMap<>());
      LatestReading reading = row.reading();
      if (reading != null) {
        metrics.merge(reading.metric(), reading,
            (current, candidate) -> candidate.timestamp().isAfter(current.timestamp())
                ? candidate : current);
      }
    }
    List<ZoneSnapshot> snapshots = new ArrayList<>(byZone.size());
    byZone.forEach((zone, metrics) ->
        snapshots.add(new ZoneSnapshot(zone, Collections.unmodifiableMap(metrics))));
    return snapshots;
  }
}
