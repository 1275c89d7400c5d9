package com.waterly.store.telemetry.controller;

import com.waterly.store.error.NotFoundException;
import com.waterly.store.telemetry.model.Weather;
import com.waterly.store.telemetry.service.LatestValueResolver;
import com.waterly.store.telemetry.service.WeatherWindowService;
import com.waterly.store.web.RequestParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/weather")
@Tag(name = "Weather")
public class WeatherController {
  private static final int MAX_FORECASTS = 240;
  private static final Instant END_OF_TIME = Instant.parse("9999-12-31T23:59:59Z");

  private final LatestValueResolver resolver;
  private final WeatherWindowService windows;
  private final Clock clock;
  private final Duration defaultBefore;
  private final Duration defaultAfter;

  public WeatherController(LatestValueResolver resolver, WeatherWindowService windows, Clock clock,
      @Value("${waterly.weather.window.before:PT12H}") Duration defaultBefore,
      @Value("${waterly.weather.window.after:PT12H}") Duration defaultAfter) {
    this.resolver = resolver;
    this.windows = windows;
    this.clock = clock;
    this.defaultBefore = defaultBefore;
    this.defaultAfter = defaultAfter;
  }

  @GetMapping("/latest")
  @Operation(summary = "Latest forecast per hour",
      description = "Most recently collected fetch for every forecast hour, ascending. Optional"
          + " bounds restrict the forecast hours.")
  public List<Weather> latest(
      @RequestParam(required = false) @Parameter(description = "First forecast hour (inclusive)")
      String from,
      @RequestParam(required = false) @Parameter(description = "Last forecast hour (inclusive)")
      String to) {
    if (from == null && to == null) {
      return resolver.latestWeather();
    }
    Instant start = RequestParams.instantOrDefault("from", from, Instant.EPOCH);
    Instant end = RequestParams.instantOrDefault("to", to, END_OF_TIME);
    return resolver.latestWeatherBetween(start, end);
  }

  @GetMapping("/latest/{forecastHour}")
  @Operation(summary = "Latest fetch for one forecast hour")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Weather.class))),
      @ApiResponse(responseCode = "404", description = "No forecast for that hour",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public Weather latestForHour(@PathVariable
      @Parameter(description = "Forecast hour, ISO-8601 or epoch seconds",
          example = "2024-05-01T12:00:00Z") String forecastHour) {
    Instant hour = RequestParams.instant("forecastHour", forecastHour);
    return resolver.latestWeather(hour)
        .orElseThrow(() -> new NotFoundException("Weather", hour.toString()));
  }

  @GetMapping("/window")
  @Operation(summary = "Forecast window",
      description = "Latest forecasts with forecast hour in [now - before, now + after].")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast rows, ascending"),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public List<Weather> window(
      @RequestParam(required = false) @Parameter(description = "Reference instant, defaults to now")
      String now,
      @RequestParam(required = false) @Parameter(description = "Look-back, ISO-8601 duration",
          example = "PT12H") String before,
      @RequestParam(required = false) @Parameter(description = "Look-ahead, ISO-8601 duration",
          example = "PT12H") String after) {
    Instant reference = RequestParams.instantOrDefault("now", now, clock.instant());
    Duration back = RequestParams.durationOrDefault("before", before, defaultBefore);
    Duration ahead = RequestParams.durationOrDefault("after", after, defaultAfter);
    return windows.window(reference, back, ahead);
  }

  @GetMapping("/forecasts")
  @Operation(summary = "Page through forecasts",
      description = "Up to |count| forecasts carrying a precipitation probability, forward from"
          + " 'from' when count is positive and backward when negative.")
  public List<Weather> forecasts(
      @RequestParam(required = false) @Parameter(description = "Starting forecast hour, defaults to now")
      String from,
      @RequestParam(defaultValue = "24") @Parameter(description = "Rows to return; sign gives direction")
      int count) {
    Instant start = RequestParams.instantOrDefault("from", from, clock.instant());
    return windows.forecastsFrom(start, RequestParams.count("count", count, MAX_FORECASTS));
  }
}
