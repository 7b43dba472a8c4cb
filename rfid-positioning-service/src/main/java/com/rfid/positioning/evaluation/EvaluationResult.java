package com.rfid.positioning.evaluation;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link PositionEvaluator}.
 *
 * @param predictions one prediction per feature row, ordered by timestamp then tag id
 * @param tagPositions one position estimate per tag, ordered by tag id
 * @param errors error summaries for tags with true coordinates, ordered by tag id
 */
public record EvaluationResult(
    List<PredictedPosition> predictions,
    List<TagPositionEstimate> tagPositions,
    List<TagErrorSummary> errors) {

  public EvaluationResult {
    predictions = List.copyOf(predictions);
    tagPositions = List.copyOf(tagPositions);
    errors = List.copyOf(errors);
  }

  public Optional<TagErrorSummary> findError(String tagId) {
    return errors.stream().filter(error -> error.tagId().equals(tagId)).findFirst();
  }

  public Optional<TagPositionEstimate> findTagPosition(String tagId) {
    return tagPositions.stream().filter(position -> position.tagId().equals(tagId)).findFirst();
  }

  public List<PredictedPosition> predictionsFor(String tagId) {
    return predictions.stream().filter(prediction -> prediction.tagId().equals(tagId)).toList();
  }
}
