package com.rfid.positioning.model;

/**
 * Supervised scalar regression capability used to learn one coordinate axis from feature
 * vectors. The positioning pipeline depends only on this contract, never on how a model is built.
 */
public interface RegressionAlgorithm {

  /**
   * Fits a model to labeled inputs.
   *
   * @param inputs one feature vector per sample, all of equal length
   * @param labels one label per sample
   * @return the fitted model
   * @throws IllegalArgumentException if inputs are empty or their shape does not match the labels
   */
  RegressionModel fit(double[][] inputs, double[] labels);

  /**
   * Returns the name of the algorithm.
   *
   * @return Algorithm name
   */
  String getName();
}
