package com.rfid.positioning.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.ml.distance.EuclideanDistance;

/**
 * k-nearest-neighbour regression in feature space, the LANDMARC approach to RFID positioning: a
 * prediction is the unweighted mean label of the k training samples closest to the input.
 *
 * <p>Ties in distance are broken by training order, so predictions are deterministic.
 */
public class NearestNeighbourRegression implements RegressionAlgorithm {

  public static final String NAME = "nearest_neighbour";

  private final int neighbours;
  private final DistanceMeasure distance = new EuclideanDistance();

  public NearestNeighbourRegression(int neighbours) {
    if (neighbours < 1) {
      throw new IllegalArgumentException("Neighbour count must be positive, got " + neighbours);
    }
    this.neighbours = neighbours;
  }

  @Override
  public RegressionModel fit(double[][] inputs, double[] labels) {
    RegressionInputs.validate(inputs, labels);
    double[][] samples = Arrays.stream(inputs).map(double[]::clone).toArray(double[][]::new);
    return new Model(samples, labels.clone());
  }

  @Override
  public String getName() {
    return NAME;
  }

  public int getNeighbours() {
    return neighbours;
  }

  private final class Model implements RegressionModel {
    private final double[][] samples;
    private final double[] labels;

    Model(double[][] samples, double[] labels) {
      this.samples = samples;
      this.labels = labels;
    }

    @Override
    public int featureCount() {
      return samples[0].length;
    }

    @Override
    public double predict(double[] input) {
      RegressionInputs.requireLength(input, featureCount());
      double[] distances = new double[samples.length];
      for (int i = 0; i < samples.length; i++) {
        distances[i] = distance.compute(samples[i], input);
      }
      int k = Math.min(neighbours, samples.length);
      return IntStream.range(0, samples.length)
          .boxed()
          .sorted(Comparator.<Integer>comparingDouble(i -> distances[i]).thenComparingInt(i -> i))
          .limit(k)
          .mapToDouble(i -> labels[i])
          .average()
          .orElseThrow();
    }
  }
}
