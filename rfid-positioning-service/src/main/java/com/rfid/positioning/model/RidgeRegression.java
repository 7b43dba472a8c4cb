package com.rfid.positioning.model;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Linear least squares with an L2 penalty on the coefficients (the intercept is not penalized).
 *
 * <p>Features and labels are centered, then {@code (XᵀX + λI) β = Xᵀy} is solved through a singular
 * value decomposition, which stays defined for rank-deficient inputs such as constant feature
 * columns. The intercept is {@code mean(y) - mean(X)·β}.
 */
public class RidgeRegression implements RegressionAlgorithm {

  public static final String NAME = "ridge";

  private final double penalty;

  public RidgeRegression(double penalty) {
    if (penalty < 0 || !Double.isFinite(penalty)) {
      throw new IllegalArgumentException("Ridge penalty must be a non-negative number, got " + penalty);
    }
    this.penalty = penalty;
  }

  @Override
  public RegressionModel fit(double[][] inputs, double[] labels) {
    RegressionInputs.validate(inputs, labels);
    int rows = inputs.length;
    int columns = inputs[0].length;

    double[] featureMeans = new double[columns];
    for (int j = 0; j < columns; j++) {
      double sum = 0.0;
      for (double[] input : inputs) {
        sum += input[j];
      }
      featureMeans[j] = sum / rows;
    }
    double labelMean = StatUtils.mean(labels);

    RealMatrix centered = new Array2DRowRealMatrix(rows, columns);
    RealVector centeredLabels = new ArrayRealVector(rows);
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < columns; j++) {
        centered.setEntry(i, j, inputs[i][j] - featureMeans[j]);
      }
      centeredLabels.setEntry(i, labels[i] - labelMean);
    }

    RealMatrix transposed = centered.transpose();
    RealMatrix normal =
        transposed.multiply(centered).add(MatrixUtils.createRealIdentityMatrix(columns).scalarMultiply(penalty));
    RealVector coefficients =
        new SingularValueDecomposition(normal).getSolver().solve(transposed.operate(centeredLabels));

    double intercept = labelMean - coefficients.dotProduct(new ArrayRealVector(featureMeans, false));
    return new Model(coefficients.toArray(), intercept);
  }

  @Override
  public String getName() {
    return NAME;
  }

  public double getPenalty() {
    return penalty;
  }

  private static final class Model implements RegressionModel {
    private final double[] coefficients;
    private final double intercept;

    Model(double[] coefficients, double intercept) {
      this.coefficients = coefficients;
      this.intercept = intercept;
    }

    @Override
    public int featureCount() {
      return coefficients.length;
    }

    @Override
    public double predict(double[] input) {
      RegressionInputs.requireLength(input, coefficients.length);
      double value = intercept;
      for (int j = 0; j < coefficients.length; j++) {
        value += coefficients[j] * input[j];
      }
      return value;
    }
  }
}
