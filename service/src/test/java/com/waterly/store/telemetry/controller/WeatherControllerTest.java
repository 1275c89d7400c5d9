package com.waterly.store.telemetry.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.waterly.store.config.SecurityConfig;
import com.waterly.store.config.StoreConfig;
import com.waterly.store.error.ValidationException;
import com.waterly.store.telemetry.model.Quantity;
import com.waterly.store.telemetry.model.Weather;
import com.waterly.store.telemetry.service.LatestValueResolver;
import com.waterly.store.telemetry.service.WeatherWindowService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WeatherController.class)
@Import({SecurityConfig.class, StoreConfig.class})
class WeatherControllerTest {
  private static final Instant HOUR = Instant.parse("2024-05-01T12:00:00Z");

  @Autowired
  private MockMvc mvc;

  @MockBean
  private LatestValueResolver resolver;

  @MockBean
  private WeatherWindowService windows;

  @Test
  void latestForHourAcceptsEpochSeconds() throws Exception {
    when(resolver.latestWeather(HOUR)).thenReturn(Optional.of(forecast()));

    mvc.perform(get("/v1/weather/latest/" + HOUR.getEpochSecond()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.forecast_hour").value("2024-05-01T12:00:00Z"))
        .andExpect(jsonPath("$.precipitation_probability").value(35.0))
        .andExpect(jsonPath("$.temperature.unit").value("C"));
  }

  @Test
  void missingHourIsNotFound() throws Exception {
    when(resolver.latestWeather(HOUR)).thenReturn(Optional.empty());

    mvc.perform(get("/v1/weather/latest/2024-05-01T12:00:00Z"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("https://docs.waterly.dev/problems/not-found"));
  }

  @Test
  void malformedInstantIsInvalidParameter() throws Exception {
    mvc.perform(get("/v1/weather/latest/yesterday"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(1001));
    verifyNoInteractions(resolver);
  }

  @Test
  void windowPassesParsedArguments() throws Exception {
    when(windows.window(any(), any(), any())).thenReturn(List.of(forecast()));

    mvc.perform(get("/v1/weather/window")
            .param("now", "2024-05-01T12:00:00Z")
            .param("before", "PT6H")
            .param("after", "PT3H"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1));

    verify(windows).window(HOUR, Duration.ofHours(6), Duration.ofHours(3));
  }

  @Test
  void negativeWindowIsProblemDetail() throws Exception {
    when(windows.window(any(), eq(Duration.ofHours(-1)), any()))
        .thenThrow(new ValidationException("before", "must not be negative, got PT-1H"));

    mvc.perform(get("/v1/weather/window").param("now", "1714564800").param("before", "-PT1H"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.field").value("before"));
  }

  @Test
  void forecastsRejectsOversizedCount() throws Exception {
    mvc.perform(get("/v1/weather/forecasts").param("count", "-10000"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(1003));
  }

  private static Weather forecast() {
    return new Weather(7L, HOUR.minusSeconds(3600), HOUR, "UTC", "open-meteo",
        Quantity.of(18.0, "C"), 35.0, Quantity.of(0.0, "mm"), Quantity.of(0.25, "m3/m3"),
        Quantity.of(1012.0, "hPa"), HOUR.minusSeconds(3500));
  }
}
