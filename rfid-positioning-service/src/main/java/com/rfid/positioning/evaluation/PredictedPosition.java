package com.rfid.positioning.evaluation;

import java.time.Instant;

/** Coordinates predicted for one feature row. */
public record PredictedPosition(String tagId, Instant timestamp, double x, double y) {}
