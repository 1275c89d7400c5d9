package com.waterly.store.telemetry.controller;

import com.waterly.store.error.NotFoundException;
import com.waterly.store.telemetry.model.Measurement;
import com.waterly.store.telemetry.model.ZoneDto;
import com.waterly.store.telemetry.model.ZoneSnapshot;
import com.waterly.store.telemetry.service.LatestValueResolver;
import com.waterly.store.telemetry.service.TelemetryStore;
import com.waterly.store.web.RequestParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/zones")
@Validated
@Tag(name = "Zones")
public class ZoneController {
  private static final String NAME_REGEX = "^[A-Za-z0-9_.-]{1,64}$";

  private final TelemetryStore store;
  private final LatestValueResolver resolver;

  public ZoneController(TelemetryStore store, LatestValueResolver resolver) {
    this.store = store;
    this.resolver = resolver;
  }

  @GetMapping
  @Operation(summary = "List zones", description = "All configured zones ordered by name.")
  public List<ZoneDto> list() {
    return store.listZones().stream().map(ZoneDto::from).toList();
  }

  @GetMapping("/latest")
  @Operation(summary = "Latest readings per zone",
      description = "One snapshot per zone with the most recent reading of every metric. Zones that"
          + " never reported carry an empty metric map.")
  public List<ZoneSnapshot> latest() {
    return resolver.latestByZone();
  }

  @GetMapping("/{zone}/metrics/{metric}/latest")
  @Operation(summary = "Latest reading of one metric")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Most recent sample",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Measurement.class))),
      @ApiResponse(responseCode = "404", description = "No sample recorded",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public Measurement latestMetric(
      @PathVariable @Pattern(regexp = NAME_REGEX)
      @Parameter(description = "Zone name", example = "Z1") String zone,
      @PathVariable @Pattern(regexp = NAME_REGEX)
      @Parameter(description = "Metric name", example = "humidity") String metric) {
    return resolver.latestMeasurement(zone, metric)
        .orElseThrow(() -> new NotFoundException("Measurement", zone + "/" + metric));
  }

  @GetMapping("/{zone}/metrics/{metric}")
  @Operation(summary = "Metric history",
      description = "Samples of one metric within [from, to], oldest first.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Samples"),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Unknown zone",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public List<Measurement> history(
      @PathVariable @Pattern(regexp = NAME_REGEX)
      @Parameter(description = "Zone name", example = "Z1") String zone,
      @PathVariable @Pattern(regexp = NAME_REGEX)
      @Parameter(description = "Metric name", example = "humidity") String metric,
      @RequestParam @Parameter(description = "Start (inclusive), ISO-8601 or epoch seconds")
      String from,
      @RequestParam @Parameter(description = "End (inclusive), ISO-8601 or epoch seconds")
      String to) {
    Instant start = RequestParams.instant("from", from);
    Instant end = RequestParams.instant("to", to);
    return store.measurementHistory(zone, metric, start, end);
  }
}
