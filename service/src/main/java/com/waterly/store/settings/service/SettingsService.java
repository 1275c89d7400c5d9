package com.waterly.store.settings.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.waterly.store.error.NotFoundException;
import com.waterly.store.error.ValidationException;
import com.waterly.store.settings.model.Setting;
import com.waterly.store.settings.repository.ConfigDao;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Typed read/write access to operator settings. Reads never fall back to defaults: a key without
 * a row is reported as missing. Writes replace the whole value.
 */
@Service
@DependsOn("migrationRunner")
public class SettingsService {
  private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

  private final ConfigDao dao;
  private final SettingCodec codec;

  public SettingsService(ConfigDao dao, SettingCodec codec) {
    this.dao = dao;
    this.codec = codec;
  }

  @Transactional(readOnly = true)
  public <T> T get(Setting<T> setting) {
    String json = dao.find(setting.key())
        .orElseThrow(() -> new NotFoundException("Setting", setting.key()));
    return codec.decode(setting, codec.parse(setting.key(), json));
  }

  @Transactional
  public <T> void set(Setting<T> setting, T value) {
    JsonNode encoded = codec.encode(setting, value);
    dao.upsert(setting.key(), codec.toJson(encoded));
    log.info("Setting {} updated", setting.key());
  }

  @Transactional(readOnly = true)
  public JsonNode getRaw(String key) {
    Setting<?> setting = codec.resolve(key);
    String json = dao.find(setting.key())
        .orElseThrow(() -> new NotFoundException("Setting", key));
    return codec.parse(key, json);
  }

  /**
   * Validates {@code value} against the key's variant and stores its canonical form.
   *
   * @return the stored value
   * @throws ValidationException for an unknown key or a value of the wrong shape; nothing is
   *     written in that case
   */
  @Transactional
  public JsonNode setRaw(String key, JsonNode value) {
    JsonNode canonical = codec.canonicalize(key, value);
    dao.upsert(key, codec.toJson(canonical));
    log.info("Setting {} updated", key);
    return canonical;
  }

  @Transactional(readOnly = true)
  public Map<String, JsonNode> all() {
    Map<String, JsonNode> values = new LinkedHashMap<>();
    dao.findAll().forEach((key, json) -> values.put(key, codec.parse(key, json)));
    return values;
  }

  /**
   * Writes the factory default of every setting that has no row. Existing rows are left alone.
   *
   * @return number of defaults written
   */
  @Transactional
  public int seedDefaults() {
    int written = 0;
    for (Setting<?> setting : Setting.values()) {
      if (dao.insertIfAbsent(setting.key(), codec.toJson(encodeDefault(setting)))) {
        log.debug("Seeded default for {}", setting.key());
        written++;
      }
    }
    return written;
  }

  private <T> JsonNode encodeDefault(Setting<T> setting) {
    return codec.encode(setting, setting.defaultValue());
  }
}
