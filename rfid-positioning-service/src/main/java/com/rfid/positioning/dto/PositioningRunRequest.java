package com.rfid.positioning.dto;

import jakarta.validation.constraints.Min;

/**
 * Optional per-run overrides of the configured pipeline settings. Null fields keep the
 * configured value.
 */
public record PositioningRunRequest(
    @Min(value = 1, message = "Warm-up size must be at least 1") Integer warmupSize,
    @Min(value = 1, message = "Window size must be at least 1") Integer windowSize,
    @Min(value = 1, message = "Feature count must be at least 1") Integer featureCount) {

  public static PositioningRunRequest defaults() {
    return new PositioningRunRequest(null, null, null);
  }
}
