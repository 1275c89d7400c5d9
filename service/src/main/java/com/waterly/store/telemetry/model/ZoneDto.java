package com.waterly.store.telemetry.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record ZoneDto(
    String name,
    String description,
    @JsonProperty("rh_sensor_address") Integer humiditySensorAddress,
    @JsonProperty("npk_sensor_address") Integer npkSensorAddress,
    @JsonProperty("relay_address") Integer relayAddress,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

  public static ZoneDto from(Zone zone) {
    return new ZoneDto(
        zone.getName(),
        zone.getDescription(),
        zone.getHumiditySensorAddress(),
        zone.getNpkSensorAddress(),
        zone.getRelayAddress(),
        zone.getCreatedAt(),
        zone.getUpdatedAt());
  }
}
