package dev.vitality.report;

import dev.vitality.accuracy.ExtractionMetrics;
import dev.vitality.quality.FailureCount;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Full result of an evaluation run.
 *
 * @param runId {@code run-<epochMillis>}
 * @param timestamp ISO-8601 instant the report was generated
 * @param byStrategy metrics aggregated over every scenario, per strategy
 * @param byScenario scenario name to strategy name to metrics
 * @param qualitySummary NVQ statistics across all scenarios, null when none were scored
 */
public record TestReport(
    String runId,
    String timestamp,
    Summary summary,
    Map<String, ExtractionMetrics> byStrategy,
    Map<String, Map<String, ExtractionMetrics>> byScenario,
    List<ScenarioResult> rawResults,
    @Nullable QualitySummary qualitySummary) {

  /** Headline numbers, taken from the best strategy. */
  public record Summary(
      double overallF1Score,
      double overallConsolidationAccuracy,
      double overallTagReuseRate,
      String bestStrategy,
      List<String> recommendations) {

    public Summary {
      recommendations = List.copyOf(recommendations);
    }
  }

  /** NVQ statistics pooled over every scored note. */
  public record QualitySummary(
      double meanNvq,
      double medianNvq,
      double passingRate,
      Map<String, Double> componentFailureRates,
      List<FailureCount> topIssues,
      List<String> qualityRecommendations) {

    public QualitySummary {
      topIssues = List.copyOf(topIssues);
      qualityRecommendations = List.copyOf(qualityRecommendations);
    }
  }
}
