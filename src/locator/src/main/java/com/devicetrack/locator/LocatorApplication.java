package com.devicetrack.locator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main Spring Boot entrypoint for the device locator service.
 *
 * <p>The telemetry export is loaded into Redis while the context starts; the read endpoints are
 * served once loading has finished.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LocatorApplication {
  public static void main(String[] args) {
    SpringApplication.run(LocatorApplication.class, args);
  }
}
