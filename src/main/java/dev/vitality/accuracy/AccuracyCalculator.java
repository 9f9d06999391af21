package dev.vitality.accuracy;

import dev.vitality.note.ExtractedNote;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Computes extraction accuracy for one scenario run.
 *
 * <p>Every expectation is attributed to at most one outcome: a consolidation expectation matched
 * by some note's content is judged through that note, and expectations no note matched count as
 * missed.
 */
@Service
public class AccuracyCalculator {

  private final GroundTruth groundTruth;

  public AccuracyCalculator(GroundTruth groundTruth) {
    this.groundTruth = groundTruth;
  }

  public ExtractionMetrics calculate(
      List<ExtractedNote> notes, TestScenario scenario, Timing timing) {
    List<ConsolidationCheck> checks = checkAll(notes, scenario);
    return new ExtractionMetrics(
        duplicateDetection(checks, scenario.expectedConsolidations().size()),
        consolidation(checks, scenario.expectedConsolidations().size()),
        tagReuse(notes, scenario.existingTags()),
        connections(notes, scenario),
        timing);
  }

  /** Merge decisions as a confusion matrix; a merge into the wrong note is both FP and FN. */
  public DuplicateDetectionMetrics duplicateDetection(
      List<ConsolidationCheck> checks, int expectedConsolidations) {
    int tp = 0;
    int fp = 0;
    int fn = 0;
    int tn = 0;
    for (ConsolidationCheck check : checks) {
      if (check.shouldHaveConsolidated()) {
        if (check.didConsolidate() && check.consolidatedCorrectly()) {
          tp++;
        } else if (check.didConsolidate()) {
          fp++;
          fn++;
        } else {
          fn++;
        }
      } else if (check.didConsolidate()) {
        fp++;
      } else {
        tn++;
      }
    }
    fn += unattributed(checks, expectedConsolidations);
    return DuplicateDetectionMetrics.fromCounts(tp, fp, fn, tn);
  }

  public ConsolidationMetrics consolidation(
      List<ConsolidationCheck> checks, int expectedConsolidations) {
    int correct = 0;
    int missed = 0;
    int wrong = 0;
    int newNotes = 0;
    for (ConsolidationCheck check : checks) {
      if (check.shouldHaveConsolidated()) {
        if (check.didConsolidate() && check.consolidatedCorrectly()) {
          correct++;
        } else if (check.didConsolidate()) {
          wrong++;
        } else {
          missed++;
        }
      } else if (check.didConsolidate()) {
        wrong++;
      } else {
        newNotes++;
      }
    }
    missed += unattributed(checks, expectedConsolidations);
    return ConsolidationMetrics.fromCounts(correct, missed, wrong, newNotes);
  }

  /** Counts exact reuse of existing tags against tags that restate one in another form. */
  public TagReuseMetrics tagReuse(List<ExtractedNote> notes, List<String> existingTags) {
    int reused = 0;
    int createdNew = 0;
    int shouldHaveReused = 0;
    int total = 0;
    for (ExtractedNote note : notes) {
      for (String tag : note.tags()) {
        total++;
        if (!groundTruth.shouldReuseTag(tag, existingTags).shouldReuse()) {
          createdNew++;
        } else if (existingTags.contains(tag)) {
          reused++;
        } else {
          shouldHaveReused++;
        }
      }
    }
    return TagReuseMetrics.fromCounts(reused, createdNew, shouldHaveReused, total);
  }

  /** Connections of untrusted matches are all spurious. */
  public ConnectionMetrics connections(List<ExtractedNote> notes, TestScenario scenario) {
    List<String> knownTitles = new ArrayList<>();
    notes.forEach(note -> knownTitles.add(note.title()));
    scenario.existingNotes().forEach(note -> knownTitles.add(note.title()));

    int correct = 0;
    int missed = 0;
    int spurious = 0;
    for (ExtractedNote note : notes) {
      MatchResult match = groundTruth.findMatchingExpectedNote(note, scenario.expectedNotes());
      if (match.trusted()) {
        ConnectionEvaluation evaluation =
            groundTruth.evaluateConnections(note, match.match(), knownTitles);
        correct += evaluation.correct();
        missed += evaluation.missed();
        spurious += evaluation.spurious();
      } else {
        spurious += note.connections().size();
      }
    }
    return ConnectionMetrics.fromCounts(correct, missed, spurious);
  }

  public List<ConsolidationCheck> checkAll(List<ExtractedNote> notes, TestScenario scenario) {
    return notes.stream()
        .map(
            note ->
                groundTruth.checkConsolidation(
                    note, scenario.existingNotes(), scenario.expectedConsolidations()))
        .toList();
  }

  private static int unattributed(List<ConsolidationCheck> checks, int expectedConsolidations) {
    long attributed =
        checks.stream()
            .mapToInt(ConsolidationCheck::expectationIndex)
            .filter(index -> index >= 0)
            .distinct()
            .count();
    return expectedConsolidations - (int) attributed;
  }
}
