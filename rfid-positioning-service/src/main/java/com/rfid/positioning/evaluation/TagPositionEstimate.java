package com.rfid.positioning.evaluation;

import com.rfid.positioning.dto.Coordinates;

/**
 * Single position for a tag: the mean of its per-row predictions.
 *
 * @param tagId evaluated tag
 * @param x mean predicted x
 * @param y mean predicted y
 * @param rowCount number of rows the mean is taken over
 */
public record TagPositionEstimate(String tagId, double x, double y, int rowCount) {

  public Coordinates coordinates() {
    return Coordinates.of(x, y);
  }
}
