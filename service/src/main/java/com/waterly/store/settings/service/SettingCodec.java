package com.waterly.store.settings.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.waterly.store.error.ValidationException;
import com.waterly.store.settings.model.Setting;
import java.io.IOException;
import org.springframework.stereotype.Component;

/**
 * Converts between stored JSON documents and typed setting values. Decoding is strict: unknown or
 * missing fields and out-of-range values are rejected.
 */
@Component
public class SettingCodec {
  private final ObjectMapper mapper;
  private final ObjectReader strictReader;

  public SettingCodec(ObjectMapper mapper) {
    this.mapper = mapper;
    this.strictReader = mapper.reader()
        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
            DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES,
            DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
  }

  public Setting<?> resolve(String key) {
    ValidationException.requireText("setting", key);
    return Setting.forKey(key)
        .orElseThrow(() -> new ValidationException(key, "unknown setting"));
  }

  public <T> T decode(Setting<T> setting, JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      throw new ValidationException(setting.key(), "value is required");
    }
    if (!value.isObject()) {
      throw new ValidationException(setting.key(), "value must be a JSON object");
    }
    try {
      return strictReader.forType(setting.type()).readValue(value);
    } catch (JsonProcessingException ex) {
      throw new ValidationException(setting.key(), describe(ex), ex);
    } catch (IOException ex) {
      throw new ValidationException(setting.key(), ex.getMessage(), ex);
    } catch (IllegalArgumentException ex) {
      throw new ValidationException(setting.key(), ex.getMessage(), ex);
    }
  }

  public <T> JsonNode encode(Setting<T> setting, T value) {
    ValidationException.requirePresent(setting.key(), value);
    return mapper.valueToTree(value);
  }

  /**
   * Decodes {@code value} as the variant bound to {@code key} and re-encodes it, yielding the
   * form that is stored.
   */
  public JsonNode canonicalize(String key, JsonNode value) {
    return roundTrip(resolve(key), value);
  }

  public JsonNode parse(String key, String json) {
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new ValidationException(key, "stored value is not valid JSON", ex);
    }
  }

  public String toJson(JsonNode value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialise setting value", ex);
    }
  }

  private <T> JsonNode roundTrip(Setting<T> setting, JsonNode value) {
    return encode(setting, decode(setting, value));
  }

  private static String describe(JsonProcessingException ex) {
    Throwable root = ex;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    if (root != ex && root.getMessage() != null) {
      return root.getMessage();
    }
    return ex.getOriginalMessage();
  }
}
