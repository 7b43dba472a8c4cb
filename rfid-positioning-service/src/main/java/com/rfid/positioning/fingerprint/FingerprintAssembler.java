package com.rfid.positioning.fingerprint;

import com.rfid.positioning.dto.Antenna;
import com.rfid.positioning.dto.Coordinates;
import com.rfid.positioning.dto.Reading;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Joins raw readings into one wide {@link FingerprintRow} per (tag, timestamp).
 *
 * <p>Assembly rules:
 *
 * <ul>
 *   <li>The antenna axis is the union of registered antennas and antennas referenced by readings,
 *       ordered by {@link AntennaLayout}. Readings from unregistered antennas are kept and logged.
 *   <li>Antennas with no reading at a row's exact timestamp leave that row's signal and read-count
 *       pair unset.
 *   <li>Several readings for the same (tag, antenna, timestamp) are averaged.
 *   <li>True coordinates are left-joined by tag id: tags missing from the map get none.
 *   <li>Rows are ordered by tag id, then by timestamp ascending.
 * </ul>
 */
@Slf4j
@Component
public class FingerprintAssembler {

  public FingerprintTable assemble(
      Collection<Reading> readings,
      Collection<Antenna> antennas,
      Map<String, Coordinates> trueCoordinates) {
    AntennaLayout layout = resolveLayout(readings, antennas);
    Map<String, Coordinates> truth =
        trueCoordinates == null ? Collections.emptyMap() : trueCoordinates;

    Map<String, TreeMap<Instant, Cell[]>> cellsByTag = new TreeMap<>();
    for (Reading reading : readings) {
      Cell[] cells =
          cellsByTag
              .computeIfAbsent(reading.tagId(), id -> new TreeMap<>())
              .computeIfAbsent(reading.timestamp(), ts -> new Cell[layout.size()]);
      int column = layout.indexOf(reading.antennaId());
      if (cells[column] == null) {
        cells[column] = new Cell();
      }
      cells[column].add(reading.signalStrength(), reading.readCount());
    }

    List<FingerprintRow> rows = new ArrayList<>();
    cellsByTag.forEach(
        (tagId, byTimestamp) ->
            byTimestamp.forEach(
                (timestamp, cells) -> rows.add(toRow(tagId, timestamp, cells, truth.get(tagId)))));

    log.info(
        "Assembled {} fingerprint rows for {} tags over {} antennas from {} readings",
        rows.size(),
        cellsByTag.size(),
        layout.size(),
        readings.size());
    return new FingerprintTable(layout, rows);
  }

  private AntennaLayout resolveLayout(Collection<Reading> readings, Collection<Antenna> antennas) {
    Set<String> registered =
        antennas.stream().map(Antenna::antennaId).collect(Collectors.toCollection(LinkedHashSet::new));
    Set<String> referenced =
        readings.stream().map(Reading::antennaId).collect(Collectors.toCollection(LinkedHashSet::new));

    Set<String> unregistered = new LinkedHashSet<>(referenced);
    unregistered.removeAll(registered);
    if (!unregistered.isEmpty()) {
      log.warn("Readings reference unregistered antennas {}; adding them to the layout", unregistered);
    }

    Set<String> all = new LinkedHashSet<>(registered);
    all.addAll(referenced);
    return AntennaLayout.of(all);
  }

  private FingerprintRow toRow(
      String tagId, Instant timestamp, Cell[] cells, Coordinates trueCoordinates) {
    List<Double> signals = new ArrayList<>(cells.length);
    List<Double> readCounts = new ArrayList<>(cells.length);
    for (Cell cell : cells) {
      signals.add(cell == null ? null : cell.meanSignal());
      readCounts.add(cell == null ? null : cell.meanReadCount());
    }
    return new FingerprintRow(tagId, timestamp, signals, readCounts, trueCoordinates);
  }

  /** Running sums of the readings that fall on one (tag, timestamp, antenna) cell. */
  private static final class Cell {
    private double signalSum;
    private double readCountSum;
    private int count;

    void add(double signal, int readCount) {
      signalSum += signal;
      readCountSum += readCount;
      count++;
    }

    double meanSignal() {
      return signalSum / count;
    }

    double meanReadCount() {
      return readCountSum / count;
    }
  }
}
