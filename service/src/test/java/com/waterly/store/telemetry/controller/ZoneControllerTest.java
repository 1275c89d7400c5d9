package com.waterly.store.telemetry.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.waterly.store.config.SecurityConfig;
import com.waterly.store.error.NotFoundException;
import com.waterly.store.telemetry.model.LatestReading;
import com.waterly.store.telemetry.model.Measurement;
import com.waterly.store.telemetry.model.Zone;
import com.waterly.store.telemetry.model.ZoneSnapshot;
import com.waterly.store.telemetry.service.LatestValueResolver;
import com.waterly.store.telemetry.service.TelemetryStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ZoneController.class)
@Import(SecurityConfig.class)
class ZoneControllerTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired
  private MockMvc mvc;

  @MockBean
  private TelemetryStore store;

  @MockBean
  private LatestValueResolver resolver;

  @Test
  void listsZonesWithHardwareAddresses() throws Exception {
    when(store.listZones()).thenReturn(List.of(
        Zone.named("Z1").describedAs("Zone 1").withHardware(10, null, 19)));

    mvc.perform(get("/v1/zones"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Z1"))
        .andExpect(jsonPath("$[0].rh_sensor_address").value(10))
        .andExpect(jsonPath("$[0].relay_address").value(19));
  }

  @Test
  void latestSnapshotsKeepEmptyZones() throws Exception {
    when(resolver.latestByZone()).thenReturn(List.of(
        new ZoneSnapshot("Z1", Map.of("humidity", new LatestReading("humidity", "%", 75.0, T0, "UTC"))),
        new ZoneSnapshot("Z2", Map.of())));

    mvc.perform(get("/v1/zones/latest"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].metrics.humidity.value").value(75.0))
        .andExpect(jsonPath("$[1].zone").value("Z2"))
        .andExpect(jsonPath("$[1].metrics").isEmpty());
  }

  @Test
  void historyRequiresParsableBounds() throws Exception {
    mvc.perform(get("/v1/zones/Z1/metrics/humidity").param("from", "soon").param("to", "2000"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(1001));
  }

  @Test
  void historyReturnsSamples() throws Exception {
    when(store.measurementHistory("Z1", "humidity", Instant.ofEpochSecond(1000), T0))
        .thenReturn(List.of(Measurement.of("Z1", "humidity", "%", Instant.ofEpochSecond(1500), "UTC", 60.0)));

    mvc.perform(get("/v1/zones/Z1/metrics/humidity")
            .param("from", "1000")
            .param("to", "2024-05-01T10:00:00Z"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].value").value(60.0));
  }

  @Test
  void historyForUnknownZoneIsNotFound() throws Exception {
    when(store.measurementHistory(anyString(), anyString(), any(), any()))
        .thenThrow(new NotFoundException("Zone", "Z8"));

    mvc.perform(get("/v1/zones/Z8/metrics/humidity").param("from", "0").param("to", "10"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Zone not found: Z8"));
  }

  @Test
  void malformedZoneNameIsBadRequest() throws Exception {
    mvc.perform(get("/v1/zones/Z1!/metrics/humidity/latest"))
        .andExpect(status().isBadRequest());
  }
}
