package com.rfid.positioning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the RFID Positioning Service.
 *
 * <p>Estimates 2-D positions of passive RFID tags from per-antenna signal readings: reference tags
 * at surveyed positions supervise X and Y regressors over sliding-window signal features, which
 * then score every tag.
 *
 * @author RFID Location Data Pipeline Team
 * @version 1.0
 */
@SpringBootApplication
public class RfidPositioningServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(RfidPositioningServiceApplication.class, args);
  }
}
