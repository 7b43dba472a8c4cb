package com.rfid.positioning.fingerprint;

import com.rfid.positioning.dto.Coordinates;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wide per-(tag, timestamp) observation: one signal and one read-count value per antenna of the
 * {@link AntennaLayout}. A {@code null} entry means the antenna did not report the tag at this
 * timestamp.
 *
 * @param tagId observed tag
 * @param timestamp observation time
 * @param signals signal strength per antenna, null where unobserved
 * @param readCounts read count per antenna, null where unobserved
 * @param trueCoordinates surveyed tag position, null when unknown
 */
public record FingerprintRow(
    String tagId,
    Instant timestamp,
    List<Double> signals,
    List<Double> readCounts,
    Coordinates trueCoordinates) {

  public FingerprintRow {
    if (signals.size() != readCounts.size()) {
      throw new IllegalArgumentException(
          "Signal and read-count columns differ in length: "
              + signals.size()
              + " vs "
              + readCounts.size());
    }
    signals = Collections.unmodifiableList(new ArrayList<>(signals));
    readCounts = Collections.unmodifiableList(new ArrayList<>(readCounts));
  }

  public int baseColumnCount() {
    return signals.size() + readCounts.size();
  }

  /**
   * Base column in layout order: signals first, then read counts.
   *
   * @return the value, or null for a gap
   */
  public Double baseValue(int column) {
    int antennaCount = signals.size();
    return column < antennaCount ? signals.get(column) : readCounts.get(column - antennaCount);
  }

  /** Signal columns followed by read-count columns. */
  public List<Double> baseValues() {
    List<Double> values = new ArrayList<>(baseColumnCount());
    values.addAll(signals);
    values.addAll(readCounts);
    return values;
  }
}
