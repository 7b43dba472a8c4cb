package com.rfid.positioning.dto;

import com.rfid.positioning.evaluation.TagErrorSummary;
import java.time.Instant;
import java.util.List;

/**
 * Result of one positioning pipeline run.
 *
 * @param generatedAt completion time
 * @param algorithm regression algorithm name
 * @param antennaCount antennas in the layout (k)
 * @param featureRowCount feature rows over all tags
 * @param featureLength full feature vector length (10k)
 * @param featureCount prefix length used for training and prediction
 * @param warmupSize warm-up size used
 * @param windowSize window size used
 * @param trainingRows reference rows the models were fitted on
 * @param predictions predicted positions of target tags
 * @param errors error summaries for tags with true coordinates
 * @param persisted whether predictions were written back to the store
 */
public record PositioningReport(
    Instant generatedAt,
    String algorithm,
    int antennaCount,
    int featureRowCount,
    int featureLength,
    int featureCount,
    int warmupSize,
    int windowSize,
    int trainingRows,
    List<TagPrediction> predictions,
    List<TagErrorSummary> errors,
    boolean persisted) {}
