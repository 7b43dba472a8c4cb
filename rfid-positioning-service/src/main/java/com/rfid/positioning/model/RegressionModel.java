package com.rfid.positioning.model;

/** Fitted regression model produced by {@link RegressionAlgorithm#fit}. */
public interface RegressionModel {

  /** Number of features the model was fitted on. */
  int featureCount();

  double predict(double[] input);

  default double[] predict(double[][] inputs) {
    double[] predictions = new double[inputs.length];
    for (int i = 0; i < inputs.length; i++) {
      predictions[i] = predict(inputs[i]);
    }
    return predictions;
  }
}
