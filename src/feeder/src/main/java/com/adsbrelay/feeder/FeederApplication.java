package com.adsbrelay.feeder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the feeder service.
 *
 * <p>The feeder reads raw Mode S frames from a dump1090-style TCP feed, rebuilds per-aircraft
 * state and broadcasts the live snapshot to WebSocket subscribers.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FeederApplication {
  /**
   * Starts the feeder application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(FeederApplication.class, args);
  }
}
