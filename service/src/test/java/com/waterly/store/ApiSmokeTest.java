package com.waterly.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.waterly.store.support.AbstractPostgresTest;
import com.waterly.store.telemetry.model.Measurement;
import com.waterly.store.telemetry.service.TelemetryStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

class ApiSmokeTest extends AbstractPostgresTest {

  @Autowired
  private TestRestTemplate restTemplate;

  @Autowired
  private TelemetryStore store;

  @Test
  void pingRespondsWithPong() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/ping",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("pong", true);
    assertThat(response.getHeaders().getFirst("X-Request-Id")).isNotBlank();
  }

  @Test
  void latestMetricIsServedAsJson() {
    store.recordMeasurement(Measurement.of("Z1", "humidity", "%", Instant.ofEpochSecond(2000), "UTC", 75.0));

    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/zones/Z1/metrics/humidity/latest",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .containsEntry("zone", "Z1")
        .containsEntry("value", 75.0)
        .containsEntry("timestamp", "1970-01-01T00:33:20Z");
  }

  @Test
  void missingMetricIsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/zones/Z2/metrics/humidity/latest",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getHeaders().getContentType().toString()).contains("application/problem+json");
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail", "instance");
  }

  @Test
  void settingRoundTripsOverHttp() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<String> body = new HttpEntity<>("{\"value\": \"metric\"}", headers);

    ResponseEntity<Map<String, Object>> put = restTemplate.exchange(
        "/v1/settings/UNITS", HttpMethod.PUT, body, new ParameterizedTypeReference<>() {});
    ResponseEntity<Map<String, Object>> get = restTemplate.exchange(
        "/v1/settings/UNITS", HttpMethod.GET, null, new ParameterizedTypeReference<>() {});

    assertThat(put.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(get.getBody()).containsEntry("value", "metric");
  }

  @Test
  void malformedSettingIsBadRequest() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<String> body = new HttpEntity<>("{\"value\": \"25:99\"}", headers);

    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/settings/WATERING_START_TIME", HttpMethod.PUT, body,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("field", "WATERING_START_TIME");
  }

  @Test
  void migrationHistoryIsExposed() {
    ResponseEntity<List<Map<String, Object>>> response = restTemplate.exchange(
        "/admin/migrations",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isNotEmpty();
    assertThat(response.getBody().get(0)).containsEntry("installed_rank", 1)
        .containsEntry("version", "1.0.0");
  }

  @Test
  void healthReportsMigrations() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/actuator/health",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsKey("components");
    @SuppressWarnings("unchecked")
    Map<String, Object> components = (Map<String, Object>) response.getBody().get("components");
    assertThat(components).containsKey("migrations");
  }
}
