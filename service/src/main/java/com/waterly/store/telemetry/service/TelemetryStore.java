package com.waterly.store.telemetry.service;

import com.waterly.store.error.DuplicateSampleException;
import com.waterly.store.error.NotFoundException;
import com.waterly.store.error.ValidationException;
import com.waterly.store.telemetry.model.Measurement;
import com.waterly.store.telemetry.model.Weather;
import com.waterly.store.telemetry.model.Zone;
import com.waterly.store.telemetry.repository.MeasurementDao;
import com.waterly.store.telemetry.repository.WeatherDao;
import com.waterly.store.telemetry.repository.ZoneRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write side of the store. Zones are mutable reference data; measurements and weather fetches are
 * append-only.
 */
@Service
@DependsOn("migrationRunner")
public class TelemetryStore {
  private static final Logger log = LoggerFactory.getLogger(TelemetryStore.class);

  private final ZoneRepository zones;
  private final MeasurementDao measurements;
  private final WeatherDao weather;
  private final Clock clock;

  public TelemetryStore(ZoneRepository zones, MeasurementDao measurements, WeatherDao weather,
      Clock clock) {
    this.zones = zones;
    this.measurements = measurements;
    this.weather = weather;
    this.clock = clock;
  }

  /**
   * Inserts the zone, or updates the stored zone of the same name. {@code createdAt} is set once;
   * {@code updatedAt} is refreshed on every update.
   */
  @Transactional
  public Zone upsertZone(Zone zone) {
    ValidationException.requirePresent("zone", zone);
    String name = ValidationException.requireText("name", zone.getName());
    Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    Zone stored = zones.findByName(name).orElse(null);
    if (stored == null) {
      zone.setCreatedAt(now);
      zone.setUpdatedAt(null);
      Zone saved = zones.save(zone);
      log.info("Created zone {}", name);
      return saved;
    }
    stored.copyAttributesFrom(zone);
    stored.setUpdatedAt(now);
    log.debug("Updated zone {}", name);
    return zones.save(stored);
  }

  @Transactional(readOnly = true)
  public Zone findZone(String name) {
    ValidationException.requireText("zone", name);
    return zones.findByName(name).orElseThrow(() -> new NotFoundException("Zone", name));
  }

  @Transactional(readOnly = true)
  public List<Zone> listZones() {
    return zones.findAllByOrderByNameAsc();
  }

  /**
   * Removes a zone together with all of its measurements.
   *
   * @return the number of measurements removed with the zone
   */
  @Transactional
  public int deleteZone(String name) {
    Zone zone = findZone(name);
    int removed = measurements.countByZone(zone.getId());
    zones.delete(zone);
    zones.flush();
    log.warn("Deleted zone {} and {} measurements", name, removed);
    return removed;
  }

  /**
   * Appends one sample.
   *
   * @throws DuplicateSampleException when a sample for the same zone, metric and second exists
   * @throws NotFoundException when the zone is unknown
   */
  @Transactional
  public Measurement recordMeasurement(Measurement measurement) {
    ValidationException.requirePresent("measurement", measurement);
    Zone zone = findZone(measurement.zone());
    try {
      return measurements.insert(zone.getId(), measurement);
    } catch (DuplicateKeyException ex) {
      log.warn("Rejected duplicate sample {}/{} at {}", measurement.zone(), measurement.metric(),
          measurement.timestamp());
      throw new DuplicateSampleException(measurement.zone(), measurement.metric(),
          measurement.timestamp(), ex);
    }
  }

  @Transactional
  public Weather recordWeather(Weather forecast) {
    ValidationException.requirePresent("forecast", forecast);
    return weather.insert(forecast);
  }

  /**
   * Records one fetch cycle. Either every row is stored or none is.
   */
  @Transactional
  public int recordWeather(List<Weather> forecasts) {
    ValidationException.requirePresent("forecasts", forecasts);
    if (forecasts.isEmpty()) {
      return 0;
    }
    int stored = weather.insertAll(forecasts);
    log.info("Recorded {} forecast rows", stored);
    return stored;
  }

  /**
   * Samples of one metric in {@code [from, to]}, oldest first.
   */
  @Transactional(readOnly = true)
  public List<Measurement> measurementHistory(String zone, String metric, Instant from,
      Instant to) {
    ValidationException.requireText("zone", zone);
    ValidationException.requireText("metric", metric);
    ValidationException.requirePresent("from", from);
    ValidationException.requirePresent("to", to);
    if (from.isAfter(to)) {
      throw new ValidationException("from", "must not be after to");
    }
    findZone(zone);
    return measurements.findHistory(zone, metric, from, to);
  }
}
