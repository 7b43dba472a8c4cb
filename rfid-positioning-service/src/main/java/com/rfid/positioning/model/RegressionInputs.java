package com.rfid.positioning.model;

/** Shape checks shared by the regression implementations. */
final class RegressionInputs {

  private RegressionInputs() {}

  static void validate(double[][] inputs, double[] labels) {
    if (inputs == null || inputs.length == 0) {
      throw new IllegalArgumentException("At least one training sample is required");
    }
    if (labels == null || labels.length != inputs.length) {
      throw new IllegalArgumentException(
          "Expected " + inputs.length + " labels, got " + (labels == null ? 0 : labels.length));
    }
    int width = inputs[0].length;
    if (width == 0) {
      throw new IllegalArgumentException("Training samples must have at least one feature");
    }
    for (double[] input : inputs) {
      requireLength(input, width);
    }
  }

  static void requireLength(double[] input, int expected) {
    if (input.length != expected) {
      throw new IllegalArgumentException(
          "Expected " + expected + " features, got " + input.length);
    }
  }
}
