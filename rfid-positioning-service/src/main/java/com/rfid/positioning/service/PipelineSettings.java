package com.rfid.positioning.service;

import com.rfid.positioning.config.PositioningProperties;
import com.rfid.positioning.dto.PositioningRunRequest;

/**
 * Window and feature settings of one pipeline run.
 *
 * @param warmupSize warm-up size W0
 * @param windowSize sliding window size W
 * @param featureCount feature prefix length, null for the full vector
 * @param statisticScale rounding scale of statistics, null for none
 */
public record PipelineSettings(
    int warmupSize, int windowSize, Integer featureCount, Integer statisticScale) {

  public static PipelineSettings from(PositioningProperties properties) {
    return new PipelineSettings(
        properties.getWindow().getWarmupSize(),
        properties.getWindow().getWindowSize(),
        properties.getModel().getFeatureCount(),
        properties.getFeatures().getStatisticScale());
  }

  /** Applies the non-null fields of {@code overrides}. */
  public PipelineSettings withOverrides(PositioningRunRequest overrides) {
    if (overrides == null) {
      return this;
    }
    return new PipelineSettings(
        overrides.warmupSize() != null ? overrides.warmupSize() : warmupSize,
        overrides.windowSize() != null ? overrides.windowSize() : windowSize,
        overrides.featureCount() != null ? overrides.featureCount() : featureCount,
        statisticScale);
  }

  /** Feature prefix length for a vector of {@code featureLength}. */
  public int resolveFeatureCount(int featureLength) {
    return featureCount != null ? featureCount : featureLength;
  }
}
