package com.waterly.store.settings.repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Raw access to the {@code config} table. Values travel as JSON text and are stored as JSONB.
 */
@Repository
public class ConfigDao {
  private final JdbcTemplate jdbc;

  public ConfigDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public Optional<String> find(String key) {
    return jdbc.queryForList("SELECT value::text FROM config WHERE setting = ?", String.class, key)
        .stream()
        .findFirst();
  }

  public void upsert(String key, String json) {
    jdbc.update("""
        INSERT INTO config (setting, value) VALUES (?, ?::jsonb)
        ON CONFLICT (setting) DO UPDATE SET value = EXCLUDED.value
        """, key, json);
  }

  /** @return true when a row was written */
  public boolean insertIfAbsent(String key, String json) {
    int rows = jdbc.update("""
        INSERT INTO config (setting, value) VALUES (?, ?::jsonb)
        ON CONFLICT (setting) DO NOTHING
        """, key, json);
    return rows > 0;
  }

  public Map<String, String> findAll() {
    Map<String, String> rows = new LinkedHashMap<>();
    jdbc.query("SELECT setting, value::text AS value FROM config ORDER BY setting",
        rs -> {
          rows.put(rs.getString("setting"), rs.getString("value"));
        });
    return rows;
  }
}
