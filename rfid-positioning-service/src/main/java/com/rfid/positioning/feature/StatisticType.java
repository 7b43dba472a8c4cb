package com.rfid.positioning.feature;

/** Column-wise window statistics, in feature-vector block order. */
public enum StatisticType {
  MEAN("avg"),
  MIN("min"),
  MAX("max"),
  STDDEV("stddev");

  private final String columnPrefix;

  StatisticType(String columnPrefix) {
    this.columnPrefix = columnPrefix;
  }

  public String getColumnPrefix() {
    return columnPrefix;
  }
}
