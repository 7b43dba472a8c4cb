package com.rfid.positioning.feature;

import com.rfid.positioning.fingerprint.FingerprintRow;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Column-wise statistics over a block of fingerprint rows.
 *
 * <p>For every base column the mean, minimum, maximum and population standard deviation are
 * computed over the rows that have a value in that column. A column with no value anywhere in the
 * block yields {@code null} for all four statistics.
 */
public final class WindowStatistics {

  private WindowStatistics() {}

  /**
   * Computes the four statistic blocks for {@code window}.
   *
   * @param window rows of the window, any order
   * @param baseColumnCount number of base columns per row (2k)
   * @param scale decimal places to round each statistic to, or null to keep full precision
   * @return {@code 4 * baseColumnCount} values in {@link StatisticType} block order
   */
  public static List<Double> compute(List<FingerprintRow> window, int baseColumnCount, Integer scale) {
    Double[][] blocks = new Double[StatisticType.values().length][baseColumnCount];
    StandardDeviation populationStdDev = new StandardDeviation(false);

    for (int column = 0; column < baseColumnCount; column++) {
      double[] values = columnValues(window, column);
      if (values.length == 0) {
        continue;
      }
      blocks[StatisticType.MEAN.ordinal()][column] = round(StatUtils.mean(values), scale);
      blocks[StatisticType.MIN.ordinal()][column] = round(StatUtils.min(values), scale);
      blocks[StatisticType.MAX.ordinal()][column] = round(StatUtils.max(values), scale);
      blocks[StatisticType.STDDEV.ordinal()][column] =
          round(populationStdDev.evaluate(values), scale);
    }

    List<Double> statistics = new ArrayList<>(blocks.length * baseColumnCount);
    for (Double[] block : blocks) {
      statistics.addAll(Arrays.asList(block));
    }
    return statistics;
  }

  private static double[] columnValues(List<FingerprintRow> window, int column) {
    return window.stream()
        .map(row -> row.baseValue(column))
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .toArray();
  }

  static Double round(double value, Integer scale) {
    if (scale == null) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
  }
}
