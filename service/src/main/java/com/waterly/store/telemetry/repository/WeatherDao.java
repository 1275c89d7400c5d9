package com.waterly.store.telemetry.repository;

import com.waterly.store.telemetry.model.Quantity;
import com.waterly.store.telemetry.model.Weather;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class WeatherDao {
  private static final String COLUMNS = """
      id, collected_at_utc, forecast_ts_utc, tz, tag,
      temperature_2m, temperature_unit,
      precipitation_probability, precipitation, precipitation_unit,
      soil_moisture_1_to_3cm, moisture_unit,
      surface_pressure, pressure_unit, created_at
      """;

  private static final String INSERT = """
      INSERT INTO weather (collected_at_utc, forecast_ts_utc, tz, tag,
        temperature_2m, temperature_unit,
        precipitation_probability, precipitation, precipitation_unit,
        soil_moisture_1_to_3cm, moisture_unit,
        surface_pressure, pressure_unit)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      """;

  private static final RowMapper<Weather> WEATHER = WeatherDao::mapWeather;

  private final JdbcTemplate jdbc;

  public WeatherDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public Weather insert(Weather w) {
    return jdbc.queryForObject(INSERT + " RETURNING " + COLUMNS, WEATHER, insertArgs(w));
  }

  public int insertAll(List<Weather> batch) {
    List<Object[]> args = new ArrayList<>(batch.size());
    for (Weather w : batch) {
      args.add(insertArgs(w));
    }
    int[] counts = jdbc.batchUpdate(INSERT, args);
    int total = 0;
    for (int count : counts) {
      // drivers may report SUCCESS_NO_INFO (-2) instead of a row count
      total += count < 0 ? 1 : count;
    }
    return total;
  }

  public List<Weather> findFetches(Instant forecastHour) {
    return jdbc.query("SELECT " + COLUMNS + " FROM weather WHERE forecast_ts_utc = ?"
        + " ORDER BY collected_at_utc, id", WEATHER, forecastHour.getEpochSecond());
  }

  public Optional<Weather> findLatest(Instant forecastHour) {
    return jdbc.query("SELECT " + COLUMNS + " FROM v_latest_weather WHERE forecast_ts_utc = ?",
        WEATHER, forecastHour.getEpochSecond()).stream().findFirst();
  }

  public List<Weather> findLatestAll() {
    return jdbc.query("SELECT " + COLUMNS + " FROM v_latest_weather ORDER BY forecast_ts_utc",
        WEATHER);
  }

  public List<Weather> findLatestBetween(Instant from, Instant to) {
    String sql = "SELECT " + COLUMNS + """
        FROM v_latest_weather
        WHERE forecast_ts_utc BETWEEN ? AND ?
        ORDER BY forecast_ts_utc
        """;
    return jdbc.query(sql, WEATHER, EpochSeconds.lowerBound(from), EpochSeconds.upperBound(to));
  }

  public List<Weather> findLatestForecastsAfter(Instant from, int limit) {
    String sql = "SELECT " + COLUMNS + """
        FROM v_latest_weather
        WHERE forecast_ts_utc >= ? AND precipitation_probability IS NOT NULL
        ORDER BY forecast_ts_utc
        LIMIT ?
        """;
    return jdbc.query(sql, WEATHER, EpochSeconds.lowerBound(from), limit);
  }

  public List<Weather> findLatestForecastsBefore(Instant from, int limit) {
    String sql = "SELECT " + COLUMNS + """
        FROM v_latest_weather
        WHERE forecast_ts_utc <= ? AND precipitation_probability IS NOT NULL
        ORDER BY forecast_ts_utc DESC
        LIMIT ?
        """;
    return jdbc.query(sql, WEATHER, EpochSeconds.upperBound(from), limit);
  }

  private static Object[] insertArgs(Weather w) {
    return new Object[]{
        w.collectedAt().getEpochSecond(),
        w.forecastHour().getEpochSecond(),
        w.timezone(),
        w.tag(),
        w.temperature().value(),
        w.temperature().unit(),
        w.precipitationProbability(),
        w.precipitation().value(),
        w.precipitation().unit(),
        w.soilMoisture().value(),
        w.soilMoisture().unit(),
        w.surfacePressure().value(),
        w.surfacePressure().unit()
    };
  }

  private static Weather mapWeather(ResultSet rs, int rowNum) throws SQLException {
    Timestamp createdAt = rs.getTimestamp("created_at");
    return new Weather(
        rs.getLong("id"),
        Instant.ofEpochSecond(rs.getLong("collected_at_utc")),
        Instant.ofEpochSecond(rs.getLong("forecast_ts_utc")),
        rs.getString("tz"),
        rs.getString("tag"),
        new Quantity(nullableDouble(rs, "temperature_2m"), rs.getString("temperature_unit")),
        nullableDouble(rs, "precipitation_probability"),
        new Quantity(nullableDouble(rs, "precipitation"), rs.getString("precipitation_unit")),
        new Quantity(nullableDouble(rs, "soil_moisture_1_to_3cm"), rs.getString("moisture_unit")),
        new Quantity(nullableDouble(rs, "surface_pressure"), rs.getString("pressure_unit")),
        createdAt != null ? createdAt.toInstant() : null);
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }
}
