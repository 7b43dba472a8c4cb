package com.rfid.positioning.model;

import com.rfid.positioning.exception.PositioningConfigurationException;
import com.rfid.positioning.feature.FeatureRow;
import com.rfid.positioning.feature.FeatureTable;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fits the X and Y coordinate regressors on reference-tag feature rows.
 *
 * <p>The regressor input is the first {@code featureCount} entries of each row's feature vector.
 * Training fails with {@link PositioningConfigurationException} when no reference rows exist, when
 * a reference row has no true coordinates, or when {@code featureCount} falls outside the vector.
 * A gap inside the selected prefix fails with {@link
 * com.rfid.positioning.exception.MissingFeatureValueException}.
 */
@Slf4j
@Component
public class CoordinateModelTrainer {

  private final RegressionAlgorithm algorithm;

  public CoordinateModelTrainer(RegressionAlgorithm algorithm) {
    this.algorithm = algorithm;
  }

  public TrainedCoordinateModels train(
      FeatureTable features, Set<String> referenceTagIds, int featureCount) {
    if (referenceTagIds == null || referenceTagIds.isEmpty()) {
      throw new PositioningConfigurationException("No reference tags are registered");
    }
    features.requireFeatureCount(featureCount);

    List<FeatureRow> referenceRows =
        features.rows().stream().filter(row -> referenceTagIds.contains(row.tagId())).toList();
    if (referenceRows.isEmpty()) {
      throw new PositioningConfigurationException(
          "None of the " + referenceTagIds.size() + " reference tags has feature rows");
    }

    double[] xLabels = new double[referenceRows.size()];
    double[] yLabels = new double[referenceRows.size()];
    for (int i = 0; i < referenceRows.size(); i++) {
      FeatureRow row = referenceRows.get(i);
      if (!row.hasTrueCoordinates()) {
        throw new PositioningConfigurationException(
            "Reference tag " + row.tagId() + " has no true coordinates");
      }
      xLabels[i] = row.trueCoordinates().x();
      yLabels[i] = row.trueCoordinates().y();
    }
    double[][] inputs = features.featureMatrix(referenceRows, featureCount);

    RegressionModel xModel = algorithm.fit(inputs, xLabels);
    RegressionModel yModel = algorithm.fit(inputs, yLabels);
    log.info(
        "Trained {} coordinate models on {} reference rows using {} of {} features",
        algorithm.getName(),
        referenceRows.size(),
        featureCount,
        features.layout().length());
    return new TrainedCoordinateModels(
        xModel, yModel, featureCount, algorithm.getName(), referenceRows.size());
  }

  public RegressionAlgorithm getAlgorithm() {
    return algorithm;
  }
}
