package com.waterly.store.settings.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class SettingsSeeder implements CommandLineRunner {
  private static final Logger log = LoggerFactory.getLogger(SettingsSeeder.class);

  private final SettingsService settings;
  private final boolean seedEnabled;

  public SettingsSeeder(SettingsService settings,
      @Value("${waterly.settings.seed-defaults:true}") boolean seedEnabled) {
    this.settings = settings;
    this.seedEnabled = seedEnabled;
  }

  @Override
  public void run(String... args) {
    if (!seedEnabled) {
      log.info("Settings seeding disabled via property waterly.settings.seed-defaults=false");
      return;
    }
    int written = settings.seedDefaults();
    if (written == 0) {
      log.info("All settings present; no defaults written");
    } else {
      log.info("Seeded {} missing settings with factory defaults", written);
    }
  }
}
