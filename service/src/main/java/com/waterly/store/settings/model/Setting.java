package com.waterly.store.settings.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A typed configuration key. Each constant binds a stored key name to the value class its JSON
 * document decodes to, and to the factory default written when the key has no row.
 *
 * @param <T> value class of the setting
 */
public final class Setting<T> {
  private static final Map<String, Setting<?>> REGISTRY = new LinkedHashMap<>();

  public static final Setting<ZonePercentages> HUMIDITY_TARGET_PERCENT = define(
      "HUMIDITY_TARGET_PERCENT", ZonePercentages.class,
      ZonePercentages.uniform(70.0, "Z1", "Z2", "Z3"));
  public static final Setting<ZonePercentages> MINIMUM_SENSOR_HUMIDITY_PERCENT = define(
      "MINIMUM_SENSOR_HUMIDITY_PERCENT", ZonePercentages.class,
      ZonePercentages.uniform(30.0, "Z1", "Z2", "Z3"));
  public static final Setting<ClockTime> WATERING_START_TIME = define(
      "WATERING_START_TIME", ClockTime.class, new ClockTime("20:30"));
  public static final Setting<Minutes> WATERING_MAX_MINUTES_PER_ZONE = define(
      "WATERING_MAX_MINUTES_PER_ZONE", Minutes.class, new Minutes(10));
  public static final Setting<CalendarDate> LAST_WATERING_DATE = define(
      "LAST_WATERING_DATE", CalendarDate.class, CalendarDate.NEVER);
  public static final Setting<Percentage> RAIN_CANCEL_PROBABILITY_THRESHOLD = define(
      "RAIN_CANCEL_PROBABILITY_THRESHOLD", Percentage.class, new Percentage(50.0));
  public static final Setting<Units> UNITS = define(
      "UNITS", Units.class, new Units(UnitSystem.IMPERIAL));
  public static final Setting<Seconds> WEATHER_CHECK_INTERVAL_SECONDS = define(
      "WEATHER_CHECK_INTERVAL_SECONDS", Seconds.class, new Seconds(6 * 3600L));
  public static final Setting<Seconds> WEATHER_CHECK_PRE_WATERING_SECONDS = define(
      "WEATHER_CHECK_PRE_WATERING_SECONDS", Seconds.class, new Seconds(30 * 60L));
  public static final Setting<Seconds> SENSOR_READ_INTERVAL_SECONDS = define(
      "SENSOR_READ_INTERVAL_SECONDS", Seconds.class, new Seconds(10 * 60L));
  public static final Setting<Checkpoint> WEATHER_LAST_CHECK_TIMESTAMP = define(
      "WEATHER_LAST_CHECK_TIMESTAMP", Checkpoint.class, Checkpoint.NEVER);
  public static final Setting<SampleCount> TREND_MAX_SAMPLES = define(
      "TREND_MAX_SAMPLES", SampleCount.class, new SampleCount(3000));
  public static final Setting<TimeZoneName> LOCAL_TIMEZONE = define(
      "LOCAL_TIMEZONE", TimeZoneName.class, new TimeZoneName("UTC"));
  public static final Setting<GeoLocation> LOCATION = define(
      "LOCATION", GeoLocation.class, new GeoLocation(0.0, 0.0));
  public static final Setting<Season> GARDENING_SEASON = define(
      "GARDENING_SEASON", Season.class, new Season("03-31", "10-31"));

  private final String key;
  private final Class<T> type;
  private final T defaultValue;

  private Setting(String key, Class<T> type, T defaultValue) {
    this.key = key;
    this.type = type;
    this.defaultValue = defaultValue;
  }

  private static <T> Setting<T> define(String key, Class<T> type, T defaultValue) {
    Setting<T> setting = new Setting<>(key, type, defaultValue);
    REGISTRY.put(key, setting);
    return setting;
  }

  public static Optional<Setting<?>> forKey(String key) {
    return Optional.ofNullable(key == null ? null : REGISTRY.get(key));
  }

  /** All keys in declaration order. */
  public static List<Setting<?>> values() {
    return Collections.unmodifiableList(new ArrayList<>(REGISTRY.values()));
  }

  public String key() {
    return key;
  }

  public Class<T> type() {
    return type;
  }

  public T defaultValue() {
    return defaultValue;
  }

  @Override
  public String toString() {
    return key;
  }
}
