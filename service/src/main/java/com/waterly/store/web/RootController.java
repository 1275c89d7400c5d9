package com.waterly.store.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Status")
public class RootController {

  @GetMapping("/")
  @Operation(summary = "Service banner")
  public Map<String, Object> root() {
    return Map.of("service", "waterly-store", "status", "ok");
  }

  @GetMapping("/v1/ping")
  @Operation(summary = "Liveness probe")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
