package com.waterly.store.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StoreConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
