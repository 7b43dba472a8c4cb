package com.rfid.positioning.model;

import com.rfid.positioning.config.PositioningProperties;

/** Enum representing all implemented coordinate regression algorithms. */
public enum RegressionAlgorithmType {
  NEAREST_NEIGHBOUR {
    @Override
    public RegressionAlgorithm create(PositioningProperties.Model model) {
      return new NearestNeighbourRegression(model.getNeighbours());
    }
  },
  RIDGE {
    @Override
    public RegressionAlgorithm create(PositioningProperties.Model model) {
      return new RidgeRegression(model.getRidgePenalty());
    }
  };

  /** Builds the algorithm with the tuning values from {@code model}. */
  public abstract RegressionAlgorithm create(PositioningProperties.Model model);
}
