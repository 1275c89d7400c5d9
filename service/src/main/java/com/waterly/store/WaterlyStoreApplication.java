package com.waterly.store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WaterlyStoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(WaterlyStoreApplication.class, args);
  }
}
