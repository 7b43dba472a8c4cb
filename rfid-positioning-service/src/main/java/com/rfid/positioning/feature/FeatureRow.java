package com.rfid.positioning.feature;

import com.rfid.positioning.dto.Coordinates;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Engineered feature vector for one fingerprint row, with the row's identification carried as
 * trailing metadata. A {@code null} feature is a gap.
 *
 * @param tagId observed tag
 * @param timestamp observation time
 * @param features values in {@link FeatureLayout} order
 * @param trueCoordinates surveyed tag position, null when unknown
 */
public record FeatureRow(
    String tagId, Instant timestamp, List<Double> features, Coordinates trueCoordinates) {

  public FeatureRow {
    features = Collections.unmodifiableList(new ArrayList<>(features));
  }

  public Double feature(int index) {
    return features.get(index);
  }

  public int length() {
    return features.size();
  }

  public boolean hasTrueCoordinates() {
    return trueCoordinates != null;
  }
}
