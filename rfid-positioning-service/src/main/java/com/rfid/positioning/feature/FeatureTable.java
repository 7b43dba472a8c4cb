package com.rfid.positioning.feature;

import com.rfid.positioning.exception.MissingFeatureValueException;
import com.rfid.positioning.exception.PositioningConfigurationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature rows of every tag ordered by timestamp, then tag id.
 *
 * @param layout column layout of every row
 * @param rows feature rows
 */
public record FeatureTable(FeatureLayout layout, List<FeatureRow> rows) {

  /** Output ordering of extracted rows: timestamp first, tag id second. */
  public static final Comparator<FeatureRow> ROW_ORDER =
      Comparator.comparing(FeatureRow::timestamp).thenComparing(FeatureRow::tagId);

  public FeatureTable {
    rows = List.copyOf(rows);
  }

  /** Rows grouped per tag in tag-id order, chronological within each tag. */
  public Map<String, List<FeatureRow>> rowsByTag() {
    Map<String, List<FeatureRow>> grouped = new LinkedHashMap<>();
    rows.stream()
        .sorted(Comparator.comparing(FeatureRow::tagId).thenComparing(FeatureRow::timestamp))
        .forEach(row -> grouped.computeIfAbsent(row.tagId(), id -> new ArrayList<>()).add(row));
    return grouped;
  }

  public int size() {
    return rows.size();
  }

  /**
   * Checks that {@code featureCount} selects a non-empty prefix of the feature vector.
   *
   * @throws PositioningConfigurationException when it is below 1 or above the vector length
   */
  public void requireFeatureCount(int featureCount) {
    if (featureCount < 1 || featureCount > layout.length()) {
      throw new PositioningConfigurationException(
          String.format(
              "Feature count %d is outside the feature vector of length %d",
              featureCount, layout.length()));
    }
  }

  /**
   * First {@code featureCount} entries of the row's feature vector.
   *
   * @throws MissingFeatureValueException when any selected entry is a gap
   */
  public double[] featurePrefix(FeatureRow row, int featureCount) {
    double[] prefix = new double[featureCount];
    for (int i = 0; i < featureCount; i++) {
      Double value = row.feature(i);
      if (value == null) {
        throw new MissingFeatureValueException(row.tagId(), row.timestamp(), layout.columnName(i));
      }
      prefix[i] = value;
    }
    return prefix;
  }

  public double[][] featureMatrix(List<FeatureRow> selected, int featureCount) {
    double[][] matrix = new double[selected.size()][];
    for (int i = 0; i < selected.size(); i++) {
      matrix[i] = featurePrefix(selected.get(i), featureCount);
    }
    return matrix;
  }
}
