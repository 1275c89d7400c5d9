package com.waterly.store.settings.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Instant of the last completed check, stored as an ISO offset date-time plus the zone it was
 * taken in. Both are null before the first check.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Checkpoint(
    @JsonProperty("__type__") String type,
    @JsonProperty("iso") String iso,
    @JsonProperty("tz") String tz
) {
  public static final String TYPE = "datetime";
  public static final Checkpoint NEVER = new Checkpoint(TYPE, null, null);

  public Checkpoint {
    if (!TYPE.equals(type)) {
      throw new IllegalArgumentException("__type__ must be '" + TYPE + "', got " + type);
    }
    if (iso != null) {
      try {
        OffsetDateTime.parse(iso);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException("'" + iso + "' is not an ISO offset date-time");
      }
    }
    if (tz != null) {
      try {
        ZoneId.of(tz);
      } catch (DateTimeException ex) {
        throw new IllegalArgumentException("unknown time zone '" + tz + "'");
      }
    }
  }

  public static Checkpoint at(OffsetDateTime when, ZoneId zone) {
    return new Checkpoint(TYPE, when.toString(), zone.getId());
  }

  public Optional<OffsetDateTime> toOffsetDateTime() {
    return Optional.ofNullable(iso).map(OffsetDateTime::parse);
  }
}
