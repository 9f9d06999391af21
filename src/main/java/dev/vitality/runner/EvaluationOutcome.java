package dev.vitality.runner;

import dev.vitality.accuracy.ExtractionMetrics;
import dev.vitality.report.ScenarioResult;
import java.util.List;
import java.util.Map;

/**
 * Per-run results and per-strategy aggregates of a suite evaluation.
 *
 * @param strategyMetrics strategy name to metrics aggregated over its runs, in first-seen order
 */
public record EvaluationOutcome(
    List<ScenarioResult> results, Map<String, ExtractionMetrics> strategyMetrics) {

  public EvaluationOutcome {
    results = List.copyOf(results);
  }
}
