package com.rfid.positioning.dto;

/**
 * Predicted position of a target tag as written back to the store.
 *
 * @param tagId target tag
 * @param predX predicted x
 * @param predY predicted y
 * @param rowCount feature rows the prediction was averaged over
 */
public record TagPrediction(String tagId, double predX, double predY, int rowCount) {}
