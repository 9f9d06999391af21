package dev.vitality.report;

import dev.vitality.accuracy.ExtractionMetrics;
import dev.vitality.nvq.NvqScore;
import dev.vitality.quality.NoteEvaluation;
import dev.vitality.quality.NoteQualityMetrics;
import dev.vitality.quality.QualityEvaluationService;
import dev.vitality.quality.QualityMetricsCalculator;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link TestReport} from per-scenario results and per-strategy aggregates.
 *
 * <p>The best strategy maximises {@code 0.4 * F1 + 0.3 * consolidation accuracy + 0.3 * tag reuse
 * rate}; ties keep the strategy listed first.
 */
@Service
public class ReportGenerator {

  static final double F1_WEIGHT = 0.4;
  static final double CONSOLIDATION_WEIGHT = 0.3;
  static final double TAG_REUSE_WEIGHT = 0.3;

  static final double RECALL_FLOOR = 0.7;
  static final double REUSE_FLOOR = 0.8;

  private final Clock clock;

  public ReportGenerator(Clock clock) {
    this.clock = clock;
  }

  public TestReport generate(
      List<ScenarioResult> results, Map<String, ExtractionMetrics> strategyMetrics) {
    Instant now = clock.instant();
    String bestStrategy = bestStrategy(strategyMetrics);
    ExtractionMetrics best = strategyMetrics.getOrDefault(bestStrategy, ExtractionMetrics.empty());

    TestReport.Summary summary =
        new TestReport.Summary(
            best.duplicateDetection().f1Score(),
            best.consolidation().accuracy(),
            best.tagReuse().reuseRate(),
            bestStrategy,
            recommendations(strategyMetrics));

    return new TestReport(
        "run-" + now.toEpochMilli(),
        now.toString(),
        summary,
        Collections.unmodifiableMap(new LinkedHashMap<>(strategyMetrics)),
        byScenario(results),
        results,
        qualitySummary(results));
  }

  static double overallScore(ExtractionMetrics metrics) {
    return F1_WEIGHT * metrics.duplicateDetection().f1Score()
        + CONSOLIDATION_WEIGHT * metrics.consolidation().accuracy()
        + TAG_REUSE_WEIGHT * metrics.tagReuse().reuseRate();
  }

  /** Empty string when there are no strategies. */
  static String bestStrategy(Map<String, ExtractionMetrics> strategyMetrics) {
    return bestBy(strategyMetrics, ReportGenerator::overallScore);
  }

  static List<String> recommendations(Map<String, ExtractionMetrics> strategyMetrics) {
    List<String> recommendations = new ArrayList<>();
    if (strategyMetrics.isEmpty()) {
      return recommendations;
    }

    String bestF1 = bestBy(strategyMetrics, m -> m.duplicateDetection().f1Score());
    String bestCons = bestBy(strategyMetrics, m -> m.consolidation().accuracy());
    String bestTags = bestBy(strategyMetrics, m -> m.tagReuse().reuseRate());
    if (bestF1.equals(bestCons) && bestCons.equals(bestTags)) {
      recommendations.add("Use \"" + bestF1 + "\" - it performs best across all metrics");
    } else {
      recommendations.add(
          "Best for duplicate detection: \"%s\" (F1: %s)"
              .formatted(
                  bestF1, percent(strategyMetrics.get(bestF1).duplicateDetection().f1Score())));
      recommendations.add(
          "Best for consolidation: \"%s\" (Accuracy: %s)"
              .formatted(
                  bestCons, percent(strategyMetrics.get(bestCons).consolidation().accuracy())));
      recommendations.add(
          "Best for tag reuse: \"%s\" (Rate: %s)"
              .formatted(bestTags, percent(strategyMetrics.get(bestTags).tagReuse().reuseRate())));
    }

    strategyMetrics.forEach(
        (name, metrics) -> {
          if (metrics.duplicateDetection().recall() < RECALL_FLOOR) {
            recommendations.add(
                "\"" + name + "\": Improve duplicate recall - too many duplicates being missed");
          }
          if (metrics.tagReuse().reuseRate() < REUSE_FLOOR) {
            recommendations.add(
                "\"" + name + "\": Improve tag matching - too many synonymous tags being created");
          }
          if (metrics.consolidation().missedConsolidations()
              > metrics.consolidation().correctConsolidations()) {
            recommendations.add(
                "\""
                    + name
                    + "\": Improve consolidation detection - more consolidations missed than"
                    + " caught");
          }
        });
    return recommendations;
  }

  static Map<String, Map<String, ExtractionMetrics>> byScenario(List<ScenarioResult> results) {
    Map<String, Map<String, ExtractionMetrics>> byScenario = new LinkedHashMap<>();
    for (ScenarioResult result : results) {
      byScenario
          .computeIfAbsent(result.scenarioName(), k -> new LinkedHashMap<>())
          .put(result.strategyName(), result.metrics());
    }
    return byScenario;
  }

  static TestReport.@Nullable QualitySummary qualitySummary(List<ScenarioResult> results) {
    List<NvqScore> scores = new ArrayList<>();
    for (ScenarioResult result : results) {
      if (result.qualityResults() != null) {
        result.qualityResults().noteResults().stream()
            .map(NoteEvaluation::nvqScore)
            .forEach(scores::add);
      }
    }
    if (scores.isEmpty()) {
      return null;
    }
    NoteQualityMetrics metrics = QualityMetricsCalculator.calculate(scores);
    return new TestReport.QualitySummary(
        metrics.meanNvq(),
        metrics.medianNvq(),
        metrics.passingRate(),
        metrics.failureRates(),
        metrics.topFailures(),
        QualityEvaluationService.recommendations(metrics));
  }

  private static String bestBy(
      Map<String, ExtractionMetrics> strategyMetrics, ToDoubleFunction<ExtractionMetrics> score) {
    String best = "";
    double bestScore = Double.NEGATIVE_INFINITY;
    for (Map.Entry<String, ExtractionMetrics> entry : strategyMetrics.entrySet()) {
      double value = score.applyAsDouble(entry.getValue());
      if (value > bestScore) {
        bestScore = value;
        best = entry.getKey();
      }
    }
    return best;
  }

  static String percent(double value) {
    return String.format(Locale.US, "%.1f%%", value * 100);
  }
}
