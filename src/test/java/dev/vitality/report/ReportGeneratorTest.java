package dev.vitality.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.vitality.accuracy.ConsolidationMetrics;
import dev.vitality.accuracy.ExtractionMetrics;
import dev.vitality.fixture.SampleMetrics;
import dev.vitality.fixture.SampleNotes;
import dev.vitality.nvq.NvqEvaluator;
import dev.vitality.parse.NoteFieldParser;
import dev.vitality.quality.QualityEvaluationResults;
import dev.vitality.quality.QualityEvaluationService;
import dev.vitality.quality.QualityOptions;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@SuppressWarnings("NullAway.Init")
class ReportGeneratorTest {

  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-02-21T14:30:00Z"), ZoneId.of("UTC"));

  private ReportGenerator generator;

  @BeforeEach
  void setUp() {
    generator = new ReportGenerator(FIXED_CLOCK);
  }

  private static Map<String, ExtractionMetrics> strategies(Object... pairs) {
    Map<String, ExtractionMetrics> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put((String) pairs[i], (ExtractionMetrics) pairs[i + 1]);
    }
    return map;
  }

  private static ScenarioResult result(String scenario, String strategy, ExtractionMetrics m) {
    return new ScenarioResult(scenario, strategy, m, List.of(), List.of(), null);
  }

  @Test
  void run_id_and_timestamp_come_from_clock() {
    TestReport report = generator.generate(List.of(), Map.of());

    assertThat(report.runId()).isEqualTo("run-1771684200000");
    assertThat(report.timestamp()).isEqualTo("2026-02-21T14:30:00Z");
  }

  @Test
  void summary_uses_best_strategy() {
    TestReport report =
        generator.generate(
            List.of(),
            strategies("keyword", SampleMetrics.partial(), "hybrid", SampleMetrics.perfect()));

    TestReport.Summary summary = report.summary();
    assertThat(summary.bestStrategy()).isEqualTo("hybrid");
    assertThat(summary.overallF1Score()).isEqualTo(1.0);
    assertThat(summary.overallConsolidationAccuracy()).isEqualTo(1.0);
    assertThat(summary.overallTagReuseRate()).isEqualTo(1.0);
  }

  @Test
  void single_winner_gets_one_headline_recommendation_plus_per_strategy_hints() {
    TestReport report =
        generator.generate(
            List.of(),
            strategies("keyword", SampleMetrics.partial(), "hybrid", SampleMetrics.perfect()));

    assertThat(report.summary().recommendations())
        .containsExactly(
            "Use \"hybrid\" - it performs best across all metrics",
            "\"keyword\": Improve duplicate recall - too many duplicates being missed",
            "\"keyword\": Improve tag matching - too many synonymous tags being created");
  }

  @Test
  void split_winners_get_one_line_per_metric() {
    List<String> recommendations =
        ReportGenerator.recommendations(
            strategies("strict", SampleMetrics.noTagReuse(), "loose", SampleMetrics.partial()));

    assertThat(recommendations)
        .startsWith(
            "Best for duplicate detection: \"strict\" (F1: 100.0%)",
            "Best for consolidation: \"strict\" (Accuracy: 100.0%)",
            "Best for tag reuse: \"loose\" (Rate: 50.0%)")
        .contains("\"strict\": Improve tag matching - too many synonymous tags being created");
  }

  @Test
  void missed_consolidations_outnumbering_caught_ones_are_flagged() {
    ExtractionMetrics missing =
        new ExtractionMetrics(
            SampleMetrics.perfect().duplicateDetection(),
            ConsolidationMetrics.fromCounts(0, 2, 0, 0),
            SampleMetrics.perfect().tagReuse(),
            SampleMetrics.perfect().connections(),
            SampleMetrics.perfect().timing());

    assertThat(ReportGenerator.recommendations(strategies("only", missing)))
        .contains(
            "\"only\": Improve consolidation detection - more consolidations missed than caught");
  }

  @Test
  void ties_keep_the_first_strategy() {
    assertThat(
            ReportGenerator.bestStrategy(
                strategies("first", SampleMetrics.perfect(), "second", SampleMetrics.perfect())))
        .isEqualTo("first");
  }

  @Test
  void no_strategies_yield_empty_best_and_default_ratios() {
    TestReport report = generator.generate(List.of(), Map.of());

    assertThat(report.summary().bestStrategy()).isEmpty();
    assertThat(report.summary().overallF1Score()).isEqualTo(1.0);
    assertThat(report.summary().recommendations()).isEmpty();
    assertThat(report.qualitySummary()).isNull();
  }

  @Test
  void overall_score_weights_metrics() {
    assertThat(ReportGenerator.overallScore(SampleMetrics.noTagReuse()))
        .isCloseTo(0.7, within(1e-9));
  }

  @Test
  void results_are_grouped_by_scenario_then_strategy() {
    List<ScenarioResult> results =
        List.of(
            result("morning", "keyword", SampleMetrics.partial()),
            result("reading", "keyword", SampleMetrics.perfect()),
            result("morning", "hybrid", SampleMetrics.perfect()));

    TestReport report = generator.generate(results, Map.of());

    assertThat(report.byScenario()).containsOnlyKeys("morning", "reading");
    assertThat(report.byScenario().get("morning"))
        .containsOnlyKeys("keyword", "hybrid")
        .containsEntry("keyword", SampleMetrics.partial());
    assertThat(report.rawResults()).hasSize(3);
  }

  @Test
  void quality_summary_pools_every_scored_note() {
    QualityEvaluationService quality =
        new QualityEvaluationService(new NvqEvaluator(new NoteFieldParser()));
    QualityEvaluationResults morning =
        quality.evaluateQuality(
            List.of(SampleNotes.perfect()),
            List.of(),
            new QualityOptions("morning", SampleNotes.CONFIG));
    QualityEvaluationResults reading =
        quality.evaluateQuality(
            List.of(SampleNotes.fact()),
            List.of(),
            new QualityOptions("reading", SampleNotes.CONFIG));
    List<ScenarioResult> results =
        List.of(
            new ScenarioResult(
                "morning", "keyword", SampleMetrics.perfect(), List.of(), List.of(), morning),
            new ScenarioResult(
                "reading", "keyword", SampleMetrics.perfect(), List.of(), List.of(), reading));

    TestReport.QualitySummary summary = generator.generate(results, Map.of()).qualitySummary();

    assertThat(summary).isNotNull();
    assertThat(summary.meanNvq()).isEqualTo(5.0);
    assertThat(summary.passingRate()).isEqualTo(0.5);
    assertThat(summary.componentFailureRates()).containsEntry("why", 0.5);
    assertThat(summary.topIssues()).hasSize(5);
    assertThat(summary.qualityRecommendations()).hasSize(4);
  }
}
