package com.rfid.positioning.fingerprint;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Ordered antenna axis shared by every pipeline stage. Column {@code i} of every signal and
 * read-count block refers to {@code antennaIds().get(i)}.
 *
 * <p>Integer ids come first in numeric order ("2" before "10"), followed by all other ids in
 * natural string order.
 */
public final class AntennaLayout {

  static final Comparator<String> ANTENNA_ORDER = AntennaLayout::compareAntennaIds;

  private final List<String> antennaIds;
  private final Map<String, Integer> indexById;

  private AntennaLayout(List<String> antennaIds) {
    this.antennaIds = Collections.unmodifiableList(antennaIds);
    this.indexById = new HashMap<>();
    for (int i = 0; i < antennaIds.size(); i++) {
      indexById.put(antennaIds.get(i), i);
    }
  }

  public static AntennaLayout of(Collection<String> antennaIds) {
    TreeSet<String> ordered = new TreeSet<>(ANTENNA_ORDER);
    ordered.addAll(antennaIds);
    return new AntennaLayout(List.copyOf(ordered));
  }

  public List<String> antennaIds() {
    return antennaIds;
  }

  public int size() {
    return antennaIds.size();
  }

  /** Number of base columns: one signal and one read-count column per antenna. */
  public int baseColumnCount() {
    return 2 * antennaIds.size();
  }

  /** @return the column index of the antenna, or -1 when the antenna is not part of the layout */
  public int indexOf(String antennaId) {
    Integer index = indexById.get(antennaId);
    return index == null ? -1 : index;
  }

  private static int compareAntennaIds(String left, String right) {
    Long leftNumber = parseNumber(left);
    Long rightNumber = parseNumber(right);
    if (leftNumber != null && rightNumber != null) {
      int byNumber = Long.compare(leftNumber, rightNumber);
      return byNumber != 0 ? byNumber : left.compareTo(right);
    }
    if (leftNumber != null) {
      return -1;
    }
    if (rightNumber != null) {
      return 1;
    }
    return left.compareTo(right);
  }

  private static Long parseNumber(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AntennaLayout other)) {
      return false;
    }
    return antennaIds.equals(other.antennaIds);
  }

  @Override
  public int hashCode() {
    return antennaIds.hashCode();
  }

  @Override
  public String toString() {
    return "AntennaLayout" + antennaIds;
  }
}
