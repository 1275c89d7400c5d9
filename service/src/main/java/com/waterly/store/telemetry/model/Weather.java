package com.waterly.store.telemetry.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.waterly.store.error.ValidationException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One fetch of the forecast for a single hour. Several fetches of the same forecast hour may be
 * stored; readers see the most recently collected one.
 */
public record Weather(
    Long id,
    @JsonProperty("collected_at") Instant collectedAt,
    @JsonProperty("forecast_hour") Instant forecastHour,
    String timezone,
    String tag,
    Quantity temperature,
    @JsonProperty("precipitation_probability") Double precipitationProbability,
    Quantity precipitation,
    @JsonProperty("soil_moisture") Quantity soilMoisture,
    @JsonProperty("surface_pressure") Quantity surfacePressure,
    @JsonProperty("created_at") Instant createdAt
) {

  public Weather {
    ValidationException.requirePresent("collectedAt", collectedAt);
    ValidationException.requirePresent("forecastHour", forecastHour);
    collectedAt = collectedAt.truncatedTo(ChronoUnit.SECONDS);
    forecastHour = forecastHour.truncatedTo(ChronoUnit.SECONDS);
    temperature = temperature != null ? temperature : Quantity.NONE;
    precipitation = precipitation != null ? precipitation : Quantity.NONE;
    soilMoisture = soilMoisture != null ? soilMoisture : Quantity.NONE;
    surfacePressure = surfacePressure != null ? surfacePressure : Quantity.NONE;
  }

  public static Weather fetched(Instant collectedAt, Instant forecastHour, String timezone,
      String tag, Quantity temperature, Double precipitationProbability, Quantity precipitation,
      Quantity soilMoisture, Quantity surfacePressure) {
    return new Weather(null, collectedAt, forecastHour, timezone, tag, temperature,
        precipitationProbability, precipitation, soilMoisture, surfacePressure, null);
  }
}
