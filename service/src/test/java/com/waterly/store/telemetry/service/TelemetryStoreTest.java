package com.waterly.store.telemetry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.waterly.store.error.DuplicateSampleException;
import com.waterly.store.error.NotFoundException;
import com.waterly.store.error.ValidationException;
import com.waterly.store.support.AbstractPostgresTest;
import com.waterly.store.telemetry.model.Measurement;
import com.waterly.store.telemetry.model.Quantity;
import com.waterly.store.telemetry.model.Weather;
import com.waterly.store.telemetry.model.Zone;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class TelemetryStoreTest extends AbstractPostgresTest {

  @Autowired
  private TelemetryStore store;

  @Autowired
  private LatestValueResolver resolver;

  @Test
  void seededZonesArePresent() {
    assertThat(store.listZones()).extracting(Zone::getName)
        .containsExactly("RPI", "Z1", "Z2", "Z3");
    assertThat(store.findZone("Z2").getNpkSensorAddress()).isEqualTo(32);
  }

  @Test
  void upsertCreatesThenUpdatesByName() {
    Zone created = store.upsertZone(Zone.named("Z9").describedAs("Herbs"));
    assertThat(created.getId()).isNotNull();
    assertThat(created.getCreatedAt()).isNotNull();
    assertThat(created.getUpdatedAt()).isNull();

    Zone updated = store.upsertZone(
        Zone.named("Z9").describedAs("Herb spiral").withHardware(13, null, 21));

    assertThat(updated.getId()).isEqualTo(created.getId());
    assertThat(updated.getDescription()).isEqualTo("Herb spiral");
    assertThat(updated.getRelayAddress()).isEqualTo(21);
    assertThat(updated.getCreatedAt()).isEqualTo(created.getCreatedAt());
    assertThat(updated.getUpdatedAt()).isNotNull();
    assertThat(store.findZone("Z9").getCreatedAt()).isEqualTo(created.getCreatedAt());
  }

  @Test
  void blankZoneNameIsRejected() {
    assertThatThrownBy(() -> store.upsertZone(Zone.named(" ")))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void recordMeasurementAssignsIdAndTruncatesToSeconds() {
    Measurement stored = store.recordMeasurement(Measurement.of("Z1", "humidity", "%",
        Instant.parse("2024-05-01T10:00:00.750Z"), "America/Chicago", 61.5));

    assertThat(stored.id()).isNotNull();
    assertThat(stored.createdAt()).isNotNull();
    assertThat(stored.timestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
  }

  @Test
  void duplicateSampleIsRejectedAndFirstValueKept() {
    Instant at = Instant.ofEpochSecond(1000);
    store.recordMeasurement(Measurement.of("Z1", "humidity", "%", at, "UTC", 75.0));

    assertThatThrownBy(() -> store.recordMeasurement(
        Measurement.of("Z1", "humidity", "%", at, "UTC", 12.0)))
        .isInstanceOf(DuplicateSampleException.class)
        .satisfies(ex -> assertThat(((DuplicateSampleException) ex).zone()).isEqualTo("Z1"));

    assertThat(resolver.latestMeasurement("Z1", "humidity"))
        .get()
        .extracting(Measurement::value)
        .isEqualTo(75.0);
    assertThat(countMeasurements()).isEqualTo(1);
  }

  @Test
  void sameSecondForAnotherMetricIsAccepted() {
    Instant at = Instant.ofEpochSecond(1000);
    store.recordMeasurement(Measurement.of("Z1", "humidity", "%", at, "UTC", 75.0));
    store.recordMeasurement(Measurement.of("Z1", "temperature", "C", at, "UTC", 21.0));

    assertThat(countMeasurements()).isEqualTo(2);
  }

  @Test
  void unknownZoneIsNotFound() {
    assertThatThrownBy(() -> store.recordMeasurement(
        Measurement.of("Z7", "humidity", "%", Instant.ofEpochSecond(1000), "UTC", 50.0)))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("Z7");
  }

  @Test
  void deleteZoneCascadesToMeasurements() {
    store.recordMeasurement(Measurement.of("Z3", "humidity", "%", Instant.ofEpochSecond(1000), "UTC", 40.0));
    store.recordMeasurement(Measurement.of("Z3", "humidity", "%", Instant.ofEpochSecond(2000), "UTC", 45.0));
    store.recordMeasurement(Measurement.of("Z1", "humidity", "%", Instant.ofEpochSecond(2000), "UTC", 45.0));

    assertThat(store.deleteZone("Z3")).isEqualTo(2);
    assertThat(countMeasurements()).isEqualTo(1);
    assertThatThrownBy(() -> store.findZone("Z3")).isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> store.deleteZone("Z3")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void historyIsInclusiveAndAscending() {
    for (long ts : new long[] {3000, 1000, 2000, 4000}) {
      store.recordMeasurement(Measurement.of("Z2", "ec", "uS/cm", Instant.ofEpochSecond(ts), "UTC", ts / 10.0));
    }

    List<Measurement> history = store.measurementHistory("Z2", "ec",
        Instant.ofEpochSecond(1000), Instant.ofEpochSecond(3000));

    assertThat(history).extracting(m -> m.timestamp().getEpochSecond())
        .containsExactly(1000L, 2000L, 3000L);
  }

  @Test
  void historyBoundsWithFractionalSecondsKeepOnlyInstantsInside() {
    for (long ts : new long[] {1000, 2000, 3000}) {
      store.recordMeasurement(Measurement.of("Z2", "ec", "uS/cm", Instant.ofEpochSecond(ts), "UTC", ts / 10.0));
    }

    List<Measurement> history = store.measurementHistory("Z2", "ec",
        Instant.ofEpochSecond(1000, 500_000_000), Instant.ofEpochSecond(3000, 500_000_000));

    assertThat(history).extracting(m -> m.timestamp().getEpochSecond())
        .containsExactly(2000L, 3000L);
  }

  @Test
  void weatherBatchIsStoredAsOneUnit() {
    Instant collected = Instant.ofEpochSecond(100);
    List<Weather> batch = List.of(
        forecast(collected, 3600, 10.0),
        forecast(collected, 7200, 20.0));

    assertThat(store.recordWeather(batch)).isEqualTo(2);
    assertThat(resolver.latestWeather()).hasSize(2);
  }

  @Test
  void refetchOfSameHourIsAccepted() {
    Weather first = store.recordWeather(forecast(Instant.ofEpochSecond(100), 5000, 10.0));
    Weather second = store.recordWeather(forecast(Instant.ofEpochSecond(200), 5000, 30.0));

    assertThat(second.id()).isGreaterThan(first.id());
    assertThat(second.temperature()).isEqualTo(Quantity.of(18.5, "C"));
  }

  private Weather forecast(Instant collected, long hour, Double probability) {
    return Weather.fetched(collected, Instant.ofEpochSecond(hour), "UTC", "test",
        Quantity.of(18.5, "C"), probability, Quantity.of(0.0, "mm"), Quantity.of(0.31, "m3/m3"),
        Quantity.of(1013.0, "hPa"));
  }

  private int countMeasurements() {
    Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM measurement", Integer.class);
    return count == null ? 0 : count;
  }
}
