package com.rfid.positioning.feature;

import com.rfid.positioning.fingerprint.AntennaLayout;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Column layout of a feature vector for k antennas:
 *
 * <pre>
 * [rssi_1..rssi_k, rc_1..rc_k,                 raw base columns   (2k)
 *  avg_*  (2k), min_* (2k), max_* (2k), stddev_* (2k)]   statistic blocks (8k)
 * </pre>
 *
 * <p>Total length is 10k. Each statistic block repeats the base column order. Tag id, timestamp
 * and true coordinates are carried beside the vector and never counted in its length.
 */
public final class FeatureLayout {

  static final String SIGNAL_PREFIX = "rssi_antenna";
  static final String READ_COUNT_PREFIX = "rc_antenna";

  private final AntennaLayout antennaLayout;
  private final List<String> columnNames;

  public FeatureLayout(AntennaLayout antennaLayout) {
    this.antennaLayout = antennaLayout;
    List<String> baseNames = new ArrayList<>(antennaLayout.baseColumnCount());
    antennaLayout.antennaIds().forEach(id -> baseNames.add(SIGNAL_PREFIX + id));
    antennaLayout.antennaIds().forEach(id -> baseNames.add(READ_COUNT_PREFIX + id));

    List<String> names = new ArrayList<>(baseNames);
    for (StatisticType statistic : StatisticType.values()) {
      baseNames.forEach(base -> names.add(statistic.getColumnPrefix() + "_" + base));
    }
    this.columnNames = Collections.unmodifiableList(names);
  }

  public AntennaLayout antennaLayout() {
    return antennaLayout;
  }

  public int baseColumnCount() {
    return antennaLayout.baseColumnCount();
  }

  /** Feature vector length L. */
  public int length() {
    return columnNames.size();
  }

  /** Index of the first column of a statistic block. */
  public int blockOffset(StatisticType statistic) {
    return baseColumnCount() * (1 + statistic.ordinal());
  }

  public String columnName(int index) {
    return columnNames.get(index);
  }

  public List<String> columnNames() {
    return columnNames;
  }
}
