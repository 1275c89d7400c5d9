package com.waterly.store.settings.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.MonthDay;
import org.junit.jupiter.api.Test;

class SettingTest {

  @Test
  void registryHoldsEveryKeyInDeclarationOrder() {
    assertThat(Setting.values()).extracting(Setting::key).containsExactly(
        "HUMIDITY_TARGET_PERCENT",
        "MINIMUM_SENSOR_HUMIDITY_PERCENT",
        "WATERING_START_TIME",
        "WATERING_MAX_MINUTES_PER_ZONE",
        "LAST_WATERING_DATE",
        "RAIN_CANCEL_PROBABILITY_THRESHOLD",
        "UNITS",
        "WEATHER_CHECK_INTERVAL_SECONDS",
        "WEATHER_CHECK_PRE_WATERING_SECONDS",
        "SENSOR_READ_INTERVAL_SECONDS",
        "WEATHER_LAST_CHECK_TIMESTAMP",
        "TREND_MAX_SAMPLES",
        "LOCAL_TIMEZONE",
        "LOCATION",
        "GARDENING_SEASON");
  }

  @Test
  void lookupByKey() {
    assertThat(Setting.forKey("UNITS")).containsSame(Setting.UNITS);
    assertThat(Setting.forKey("units")).isEmpty();
    assertThat(Setting.forKey(null)).isEmpty();
  }

  @Test
  void factoryDefaults() {
    assertThat(Setting.WATERING_START_TIME.defaultValue().value()).isEqualTo("20:30");
    assertThat(Setting.WEATHER_CHECK_INTERVAL_SECONDS.defaultValue().value()).isEqualTo(21600L);
    assertThat(Setting.UNITS.defaultValue().value()).isEqualTo(UnitSystem.IMPERIAL);
    assertThat(Setting.HUMIDITY_TARGET_PERCENT.defaultValue().forZone("Z3")).isEqualTo(70.0);
    assertThat(Setting.LAST_WATERING_DATE.defaultValue().toLocalDate()).isEmpty();
  }

  @Test
  void seasonWrapsAroundNewYear() {
    Season summer = new Season("03-31", "10-31");
    Season winter = new Season("11-15", "02-15");

    assertThat(summer.contains(MonthDay.of(7, 1))).isTrue();
    assertThat(summer.contains(MonthDay.of(12, 1))).isFalse();
    assertThat(winter.contains(MonthDay.of(1, 10))).isTrue();
    assertThat(winter.contains(MonthDay.of(6, 10))).isFalse();
  }
}
