package com.rfid.positioning.evaluation;

import com.rfid.positioning.feature.FeatureRow;
import com.rfid.positioning.feature.FeatureTable;
import com.rfid.positioning.model.TrainedCoordinateModels;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Applies trained coordinate models to every tag's feature rows.
 *
 * <p>Each row is predicted from the same feature-vector prefix used in training. For tags with
 * true coordinates the mean absolute error per axis, and their average, is reported. Tags are
 * evaluated independently on the supplied executor.
 */
@Slf4j
@Component
public class PositionEvaluator {

  private static final Comparator<PredictedPosition> PREDICTION_ORDER =
      Comparator.comparing(PredictedPosition::timestamp).thenComparing(PredictedPosition::tagId);

  private final Executor executor;

  public PositionEvaluator(@Qualifier("positioningTaskExecutor") Executor executor) {
    this.executor = executor;
  }

  public EvaluationResult evaluate(FeatureTable features, TrainedCoordinateModels models) {
    features.requireFeatureCount(models.featureCount());

    List<CompletableFuture<TagEvaluation>> tasks = new ArrayList<>();
    features
        .rowsByTag()
        .forEach(
            (tagId, rows) ->
                tasks.add(
                    CompletableFuture.supplyAsync(
                        () -> evaluateTag(tagId, rows, features, models), executor)));

    List<PredictedPosition> predictions = new ArrayList<>(features.size());
    List<TagPositionEstimate> tagPositions = new ArrayList<>(tasks.size());
    List<TagErrorSummary> errors = new ArrayList<>();
    try {
      for (CompletableFuture<TagEvaluation> task : tasks) {
        TagEvaluation evaluation = task.join();
        predictions.addAll(evaluation.predictions());
        tagPositions.add(evaluation.position());
        if (evaluation.error() != null) {
          errors.add(evaluation.error());
        }
      }
    } catch (CompletionException e) {
      throw e.getCause() instanceof RuntimeException cause ? cause : e;
    }
    predictions.sort(PREDICTION_ORDER);

    log.info(
        "Evaluated {} rows for {} tags; {} tags have error summaries",
        predictions.size(),
        tagPositions.size(),
        errors.size());
    return new EvaluationResult(predictions, tagPositions, errors);
  }

  private TagEvaluation evaluateTag(
      String tagId, List<FeatureRow> rows, FeatureTable features, TrainedCoordinateModels models) {
    double[][] inputs = features.featureMatrix(rows, models.featureCount());
    double[] xPredicted = models.xModel().predict(inputs);
    double[] yPredicted = models.yModel().predict(inputs);

    List<PredictedPosition> predictions = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      FeatureRow row = rows.get(i);
      predictions.add(new PredictedPosition(tagId, row.timestamp(), xPredicted[i], yPredicted[i]));
    }
    TagPositionEstimate position =
        new TagPositionEstimate(
            tagId, StatUtils.mean(xPredicted), StatUtils.mean(yPredicted), rows.size());

    TagErrorSummary error = null;
    if (rows.stream().allMatch(FeatureRow::hasTrueCoordinates)) {
      double[] xErrors = new double[rows.size()];
      double[] yErrors = new double[rows.size()];
      for (int i = 0; i < rows.size(); i++) {
        xErrors[i] = Math.abs(rows.get(i).trueCoordinates().x() - xPredicted[i]);
        yErrors[i] = Math.abs(rows.get(i).trueCoordinates().y() - yPredicted[i]);
      }
      error = TagErrorSummary.of(tagId, StatUtils.mean(xErrors), StatUtils.mean(yErrors));
      log.debug("Tag {}: MAE_x={}, MAE_y={}", tagId, error.maeX(), error.maeY());
    }
    return new TagEvaluation(predictions, position, error);
  }

  private record TagEvaluation(
      List<PredictedPosition> predictions, TagPositionEstimate position, TagErrorSummary error) {}
}
