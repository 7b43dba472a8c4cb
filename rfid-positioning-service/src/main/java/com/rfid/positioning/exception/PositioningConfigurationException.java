package com.rfid.positioning.exception;

/**
 * Thrown when a pipeline step is asked to run with settings or inputs it cannot work with: an
 * empty reference set, a feature count outside the feature vector, non-positive window sizes, or
 * a reference row without true coordinates. Not retryable.
 */
public class PositioningConfigurationException extends RuntimeException {

  public PositioningConfigurationException(String message) {
    super(message);
  }

  public PositioningConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
