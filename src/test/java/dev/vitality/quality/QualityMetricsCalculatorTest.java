package dev.vitality.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import dev.vitality.fixture.SampleNotes;
import dev.vitality.nvq.NvqComponent;
import dev.vitality.nvq.NvqEvaluator;
import dev.vitality.nvq.NvqScore;
import dev.vitality.parse.NoteFieldParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class QualityMetricsCalculatorTest {

  private final NvqEvaluator evaluator = new NvqEvaluator(new NoteFieldParser());

  private final NvqScore perfect = evaluator.evaluate(SampleNotes.perfect(), SampleNotes.CONFIG);
  private final NvqScore fact = evaluator.evaluate(SampleNotes.fact(), SampleNotes.CONFIG);

  @Test
  void histograms_hold_every_bucket() {
    NoteQualityMetrics metrics = QualityMetricsCalculator.calculate(List.of(fact, fact, perfect));

    assertThat(metrics.distribution(NvqComponent.WHY))
        .containsExactly(entry(0, 2), entry(1, 0), entry(2, 0), entry(3, 1));
    assertThat(metrics.distribution(NvqComponent.ORIGINALITY)).containsOnlyKeys(0, 1);
  }

  @Test
  void upper_median_is_used() {
    NoteQualityMetrics metrics = QualityMetricsCalculator.calculate(List.of(fact, fact, perfect));

    assertThat(metrics.medianNvq()).isZero();
    assertThat(metrics.meanNvq()).isEqualTo(10.0 / 3.0);
    assertThat(metrics.totalNotesEvaluated()).isEqualTo(3);
  }

  @Test
  void diagnostic_counts() {
    NoteQualityMetrics metrics = QualityMetricsCalculator.calculate(List.of(fact, perfect));

    assertThat(metrics.notesWithPurpose()).isEqualTo(1);
    assertThat(metrics.notesWithCompleteMetadata()).isEqualTo(1);
    assertThat(metrics.notesWithFunctionalTags()).isEqualTo(1);
    assertThat(metrics.notesWithTwoLinks()).isEqualTo(1);
    // an unquoted fact still has a high synthesis ratio
    assertThat(metrics.notesThatAreSynthesis()).isEqualTo(2);
  }

  @Test
  void top_failures_are_counted_per_reason_in_rubric_order_on_ties() {
    List<FailureCount> failures = QualityMetricsCalculator.topFailures(List.of(fact, fact));

    assertThat(failures).hasSize(5);
    assertThat(failures.get(0))
        .isEqualTo(new FailureCount(NvqComponent.WHY, "Missing first-person statement", 2));
    assertThat(failures)
        .extracting(FailureCount::component)
        .containsExactly(NvqComponent.values());
  }

  @Test
  void empty_scores_give_empty_metrics() {
    assertThat(QualityMetricsCalculator.calculate(List.of()))
        .isEqualTo(NoteQualityMetrics.empty());
  }
}
