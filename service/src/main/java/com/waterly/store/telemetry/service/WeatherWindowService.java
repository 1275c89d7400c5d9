package com.waterly.store.telemetry.service;

import com.waterly.store.error.ValidationException;
import com.waterly.store.telemetry.model.Weather;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Forecast rows around a reference instant, as the watering planner consumes them. Every call
 * reads the database; nothing is cached.
 */
@Service
public class WeatherWindowService {
  private static final Logger log = LoggerFactory.getLogger(WeatherWindowService.class);

  private final LatestValueResolver resolver;
  private final Clock clock;
  private final Duration defaultBefore;
  private final Duration defaultAfter;

  public WeatherWindowService(LatestValueResolver resolver, Clock clock,
      @Value("${waterly.weather.window.before:PT12H}") Duration defaultBefore,
      @Value("${waterly.weather.window.after:PT12H}") Duration defaultAfter) {
    this.resolver = resolver;
    this.clock = clock;
    this.defaultBefore = defaultBefore;
    this.defaultAfter = defaultAfter;
  }

  /**
   * Latest-resolved forecasts with forecast hour in {@code [now - before, now + after]},
   * ascending by forecast hour.
   */
  public List<Weather> window(Instant now, Duration before, Duration after) {
    TimeWindow window = TimeWindow.around(now, before, after);
    List<Weather> rows = resolver.latestWeatherBetween(window.from(), window.to());
    log.debug("Weather window {}..{} holds {} rows", window.from(), window.to(), rows.size());
    return rows;
  }

  public List<Weather> window(Instant now) {
    return window(now, defaultBefore, defaultAfter);
  }

  public List<Weather> currentWindow() {
    return window(clock.instant());
  }

  /**
   * Pages through forecasts that carry a precipitation probability. A positive {@code count}
   * walks forward from {@code from} in ascending order; a negative one walks backward in
   * descending order. Both include {@code from} itself.
   */
  public List<Weather> forecastsFrom(Instant from, int count) {
    ValidationException.requirePresent("from", from);
    if (count == 0) {
      return List.of();
    }
    if (count > 0) {
      return resolver.latestForecastsAfter(from, count);
    }
    if (count == Integer.MIN_VALUE) {
      throw new ValidationException("count", "must be greater than " + Integer.MIN_VALUE);
    }
    return resolver.latestForecastsBefore(from, -count);
  }
}
