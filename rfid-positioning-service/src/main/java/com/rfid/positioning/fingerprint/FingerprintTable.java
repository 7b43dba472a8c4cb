package com.rfid.positioning.fingerprint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembled fingerprints ordered by tag id, then by timestamp ascending within each tag.
 *
 * @param layout antenna axis of every row
 * @param rows fingerprint rows
 */
public record FingerprintTable(AntennaLayout layout, List<FingerprintRow> rows) {

  public FingerprintTable {
    rows = List.copyOf(rows);
  }

  /** Rows grouped per tag, preserving tag order and chronological order inside each tag. */
  public Map<String, List<FingerprintRow>> rowsByTag() {
    Map<String, List<FingerprintRow>> grouped = new LinkedHashMap<>();
    for (FingerprintRow row : rows) {
      grouped.computeIfAbsent(row.tagId(), id -> new ArrayList<>()).add(row);
    }
    return grouped;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }
}
