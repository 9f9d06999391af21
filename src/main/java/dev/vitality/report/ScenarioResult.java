package dev.vitality.report;

import dev.vitality.accuracy.ExtractionMetrics;
import dev.vitality.note.ExtractedNote;
import dev.vitality.quality.QualityEvaluationResults;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Metrics for one strategy on one scenario, with the raw notes kept for debugging.
 *
 * @param errors problems reported by the run or found while evaluating it
 * @param qualityResults NVQ evaluation, present when the scenario has quality expectations
 */
public record ScenarioResult(
    String scenarioName,
    String strategyName,
    ExtractionMetrics metrics,
    List<ExtractedNote> extractedNotes,
    List<String> errors,
    @Nullable QualityEvaluationResults qualityResults) {

  public ScenarioResult {
    extractedNotes = List.copyOf(extractedNotes);
    errors = List.copyOf(errors);
  }
}
