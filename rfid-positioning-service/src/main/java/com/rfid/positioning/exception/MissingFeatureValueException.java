package com.rfid.positioning.exception;

import java.time.Instant;

/**
 * Thrown when a feature row selected for model fitting or prediction has no value for one of the
 * selected feature columns. Gaps are never replaced by a sentinel number.
 */
public class MissingFeatureValueException extends RuntimeException {

  private final String tagId;
  private final Instant timestamp;
  private final String featureName;

  public MissingFeatureValueException(String tagId, Instant timestamp, String featureName) {
    super(
        String.format(
            "Feature %s has no value for tag %s at %s; resolve gaps before training or prediction",
            featureName, tagId, timestamp));
    this.tagId = tagId;
    this.timestamp = timestamp;
    this.featureName = featureName;
  }

  public String getTagId() {
    return tagId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public String getFeatureName() {
    return featureName;
  }
}
