package com.rfid.positioning.dto;

/**
 * Planar (x, y) position in the deployment's local coordinate frame.
 *
 * <p>Used both for the surveyed position of reference tags and for positions predicted by the
 * coordinate regressors.
 */
public record Coordinates(double x, double y) {
  public Coordinates {
    if (!Double.isFinite(x)) {
      throw new IllegalArgumentException("Invalid x coordinate: " + x);
    }
    if (!Double.isFinite(y)) {
      throw new IllegalArgumentException("Invalid y coordinate: " + y);
    }
  }

  public static Coordinates of(double x, double y) {
    return new Coordinates(x, y);
  }
}
