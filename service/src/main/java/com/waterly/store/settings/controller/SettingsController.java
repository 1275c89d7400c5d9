package com.waterly.store.settings.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.waterly.store.settings.service.SettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/settings")
@Tag(name = "Settings")
public class SettingsController {
  private final SettingsService settings;

  public SettingsController(SettingsService settings) {
    this.settings = settings;
  }

  @GetMapping
  @Operation(summary = "All stored settings", description = "Every stored setting keyed by name.")
  public Map<String, JsonNode> all() {
    return settings.all();
  }

  @GetMapping("/{key}")
  @Operation(summary = "Read one setting")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Stored JSON value"),
      @ApiResponse(responseCode = "400", description = "Unknown setting",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Setting has no stored value",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public JsonNode get(@PathVariable
      @Parameter(description = "Setting key", example = "WATERING_START_TIME") String key) {
    return settings.getRaw(key);
  }

  @PutMapping("/{key}")
  @Operation(summary = "Replace one setting",
      description = "Validates the value against the setting's shape and stores its canonical form.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Stored JSON value"),
      @ApiResponse(responseCode = "400", description = "Unknown setting or malformed value",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public JsonNode put(@PathVariable
      @Parameter(description = "Setting key", example = "WATERING_START_TIME") String key,
      @RequestBody JsonNode value) {
    return settings.setRaw(key, value);
  }
}
