package com.rfid.positioning.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mean absolute prediction error of one tag with known true coordinates.
 *
 * @param tagId evaluated tag
 * @param maeX mean absolute error on the x axis
 * @param maeY mean absolute error on the y axis
 * @param maeAvg average of the two axis errors
 */
public record TagErrorSummary(
    String tagId,
    @JsonProperty("MAE_x") double maeX,
    @JsonProperty("MAE_y") double maeY,
    @JsonProperty("MAE_avg") double maeAvg) {

  public static TagErrorSummary of(String tagId, double maeX, double maeY) {
    return new TagErrorSummary(tagId, maeX, maeY, (maeX + maeY) / 2.0);
  }
}
