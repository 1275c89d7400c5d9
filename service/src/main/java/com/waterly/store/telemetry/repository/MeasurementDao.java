package com.waterly.store.telemetry.repository;

import com.waterly.store.telemetry.model.LatestReading;
import com.waterly.store.telemetry.model.Measurement;
import com.waterly.store.telemetry.model.ZoneReading;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class MeasurementDao {
  private static final RowMapper<Measurement> MEASUREMENT = MeasurementDao::mapMeasurement;

  private final JdbcTemplate jdbc;

  public MeasurementDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  /**
   * Appends a sample. A clash on (zone, metric, timestamp) surfaces as
   * {@link org.springframework.dao.DuplicateKeyException}.
   */
  public Measurement insert(long zoneId, Measurement m) {
    String sql = """
      INSERT INTO measurement (zone_id, name, unit, ts_utc, tz, reading)
      VALUES (?, ?, ?, ?, ?, ?)
      RETURNING id, created_at
    """;
    return jdbc.queryForObject(sql, (rs, i) -> new Measurement(
            rs.getLong("id"), m.zone(), m.metric(), m.unit(), m.timestamp(), m.timezone(),
            m.value(), rs.getTimestamp("created_at").toInstant()),
        zoneId, m.metric(), m.unit(), m.timestamp().getEpochSecond(), m.timezone(), m.value());
  }

  public int countByZone(long zoneId) {
    Integer count = jdbc.queryForObject(
        "SELECT COUNT(*) FROM measurement WHERE zone_id = ?", Integer.class, zoneId);
    return count == null ? 0 : count;
  }

  public List<Measurement> findHistory(String zone, String metric, Instant from, Instant to) {
    String sql = """
      SELECT m.id, z.name AS zone_name, m.name, m.unit, m.ts_utc, m.tz, m.reading, m.created_at
      FROM measurement m
      JOIN zone z ON z.id = m.zone_id
      WHERE z.name = ? AND m.name = ? AND m.ts_utc BETWEEN ? AND ?
      ORDER BY m.ts_utc
    """;
    return jdbc.query(sql, MEASUREMENT, zone, metric,
        EpochSeconds.lowerBound(from), EpochSeconds.upperBound(to));
  }

  public Optional<Measurement> findLatest(String zone, String metric) {
    String sql = """
      SELECT id, zone_name, name, unit, ts_utc, tz, reading, created_at
      FROM v_latest_measurement
      WHERE zone_name = ? AND name = ?
    """;
    return jdbc.query(sql, MEASUREMENT, zone, metric).stream().findFirst();
  }

  public List<Measurement> findLatestAll() {
    String sql = """
      SELECT id, zone_name, name, unit, ts_utc, tz, reading, created_at
      FROM v_latest_measurement
      ORDER BY zone_name, name
    """;
    return jdbc.query(sql, MEASUREMENT);
  }

  public List<ZoneReading> findLatestByZone() {
    String sql = """
      SELECT zone_name, metric_name, unit, reading, ts_utc, tz
      FROM v_latest_by_zone
      ORDER BY zone_name, metric_name NULLS FIRST
    """;
    return jdbc.query(sql, (rs, i) -> {
      String metric = rs.getString("metric_name");
      LatestReading reading = metric == null ? null : new LatestReading(
          metric,
          rs.getString("unit"),
          rs.getDouble("reading"),
          Instant.ofEpochSecond(rs.getLong("ts_utc")),
          rs.getString("tz"));
      return new ZoneReading(rs.getString("zone_name"), reading);
    });
  }

  private static Measurement mapMeasurement(ResultSet rs, int rowNum) throws SQLException {
    Timestamp createdAt = rs.getTimestamp("created_at");
    return new Measurement(
        rs.getLong("id"),
        rs.getString("zone_name"),
        rs.getString("name"),
        rs.getString("unit"),
        Instant.ofEpochSecond(rs.getLong("ts_utc")),
        rs.getString("tz"),
        rs.getDouble("reading"),
        createdAt != null ? createdAt.toInstant() : null);
  }
}
