package com.rfid.positioning.feature;

import com.rfid.positioning.exception.PositioningConfigurationException;
import com.rfid.positioning.fingerprint.FingerprintRow;
import com.rfid.positioning.fingerprint.FingerprintTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts each tag's chronological fingerprint rows into feature rows using a two-phase window.
 *
 * <p>For a tag with n rows, a warm-up size W0 and a window size W:
 *
 * <ol>
 *   <li>Warm-up: rows {@code 0 .. min(W0, n) - 1} all receive the same statistics, computed once
 *       over that whole block.
 *   <li>Sliding: every row {@code i >= W0} receives statistics over its trailing window {@code
 *       [max(0, i - W + 1), i]}, which grows until it reaches width W and then slides.
 * </ol>
 *
 * <p>Warm-up rows share one statistic vector; they never use an expanding window.
 *
 * <p>Tags are processed independently on the supplied executor. The output keeps one feature row
 * per input row and is ordered by timestamp, then tag id.
 */
@Slf4j
public class WindowFeatureExtractor {

  private final int warmupSize;
  private final int windowSize;
  private final Integer statisticScale;
  private final Executor executor;

  /**
   * @param warmupSize rows sharing the warm-up statistics (W0)
   * @param windowSize width of the trailing window (W)
   * @param statisticScale decimal places statistics are rounded to, null for no rounding
   * @param executor executor running per-tag extraction
   * @throws PositioningConfigurationException if either size is not positive
   */
  public WindowFeatureExtractor(
      int warmupSize, int windowSize, Integer statisticScale, Executor executor) {
    if (warmupSize < 1) {
      throw new PositioningConfigurationException(
          "Warm-up size must be positive, got " + warmupSize);
    }
    if (windowSize < 1) {
      throw new PositioningConfigurationException(
          "Window size must be positive, got " + windowSize);
    }
    if (statisticScale != null && statisticScale < 0) {
      throw new PositioningConfigurationException(
          "Statistic scale must not be negative, got " + statisticScale);
    }
    this.warmupSize = warmupSize;
    this.windowSize = windowSize;
    this.statisticScale = statisticScale;
    this.executor = executor;
  }

  public FeatureTable extract(FingerprintTable fingerprints) {
    FeatureLayout layout = new FeatureLayout(fingerprints.layout());
    Map<String, List<FingerprintRow>> rowsByTag = fingerprints.rowsByTag();

    List<CompletableFuture<List<FeatureRow>>> tasks = new ArrayList<>(rowsByTag.size());
    rowsByTag.forEach(
        (tagId, rows) ->
            tasks.add(
                CompletableFuture.supplyAsync(
                    () -> extractTag(rows, layout.baseColumnCount()), executor)));

    List<FeatureRow> features = new ArrayList<>(fingerprints.size());
    try {
      tasks.forEach(task -> features.addAll(task.join()));
    } catch (CompletionException e) {
      throw unwrap(e);
    }
    features.sort(FeatureTable.ROW_ORDER);

    log.info(
        "Extracted {} feature rows of length {} for {} tags (warmupSize={}, windowSize={})",
        features.size(),
        layout.length(),
        rowsByTag.size(),
        warmupSize,
        windowSize);
    return new FeatureTable(layout, features);
  }

  /**
   * Feature rows for one tag's rows, in the same chronological order.
   *
   * @param rows one tag's rows, oldest first
   */
  List<FeatureRow> extractTag(List<FingerprintRow> rows, int baseColumnCount) {
    int n = rows.size();
    List<FeatureRow> features = new ArrayList<>(n);
    if (n == 0) {
      return features;
    }

    int warmupEnd = Math.min(warmupSize, n);
    List<Double> warmupStatistics =
        WindowStatistics.compute(rows.subList(0, warmupEnd), baseColumnCount, statisticScale);
    for (int i = 0; i < warmupEnd; i++) {
      features.add(toFeatureRow(rows.get(i), warmupStatistics));
    }

    for (int i = warmupSize; i < n; i++) {
      int windowStart = Math.max(0, i - windowSize + 1);
      List<Double> statistics =
          WindowStatistics.compute(rows.subList(windowStart, i + 1), baseColumnCount, statisticScale);
      features.add(toFeatureRow(rows.get(i), statistics));
    }

    log.debug("Tag {}: {} warm-up rows, {} sliding rows", rows.get(0).tagId(), warmupEnd, n - warmupEnd);
    return features;
  }

  private FeatureRow toFeatureRow(FingerprintRow row, List<Double> statistics) {
    List<Double> vector = new ArrayList<>(row.baseColumnCount() + statistics.size());
    vector.addAll(row.baseValues());
    vector.addAll(statistics);
    return new FeatureRow(row.tagId(), row.timestamp(), vector, row.trueCoordinates());
  }

  private static RuntimeException unwrap(CompletionException e) {
    return e.getCause() instanceof RuntimeException cause ? cause : e;
  }

  public int getWarmupSize() {
    return warmupSize;
  }

  public int getWindowSize() {
    return windowSize;
  }
}
