package dev.vitality.quality;

import dev.vitality.note.ExtractedNote;
import dev.vitality.nvq.FailureReasons;
import dev.vitality.nvq.NvqComponent;
import dev.vitality.nvq.NvqEvaluator;
import dev.vitality.nvq.NvqScore;
import dev.vitality.nvq.QualityNote;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores a scenario's notes against the NVQ rubric and summarises where they fall short.
 *
 * <p>Notes are scored independently on a parallel stream; result order follows input order.
 */
@Service
public class QualityEvaluationService {

  private static final Logger log = LoggerFactory.getLogger(QualityEvaluationService.class);

  static final double FAILURE_RATE_LIMIT = 0.3;
  static final double ORIGINALITY_FAILURE_RATE_LIMIT = 0.5;

  private final NvqEvaluator evaluator;

  public QualityEvaluationService(NvqEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  public QualityEvaluationResults evaluateQuality(
      List<ExtractedNote> notes, List<QualityExpectation> expectations, QualityOptions options) {
    List<NoteEvaluation> results =
        notes.parallelStream().map(note -> evaluateNote(note, expectations, options)).toList();

    NoteQualityMetrics metrics =
        QualityMetricsCalculator.calculate(
            results.stream().map(NoteEvaluation::nvqScore).toList());
    List<String> recommendations = recommendations(metrics);

    log.info(
        "Quality for '{}': {} notes, mean NVQ {}, passing rate {}",
        options.scenarioName(),
        metrics.totalNotesEvaluated(),
        String.format("%.2f", metrics.meanNvq()),
        String.format("%.2f", metrics.passingRate()));
    return new QualityEvaluationResults(options.scenarioName(), results, metrics, recommendations);
  }

  NoteEvaluation evaluateNote(
      ExtractedNote note, List<QualityExpectation> expectations, QualityOptions options) {
    QualityNote qualityNote = evaluator.toQualityNote(note);
    NvqScore score = evaluator.evaluate(qualityNote, options.config());
    QualityExpectation expectation = findMatchingExpectation(note, expectations);

    List<String> issues = new ArrayList<>();
    if (!score.passing()) {
      issues.add("NVQ score " + score.total() + "/10 below threshold");
    }
    for (NvqComponent component : score.failingComponents()) {
      issues.add(FailureReasons.issueFor(score, component));
    }
    if (expectation != null) {
      issues.addAll(expectation.conformanceIssues(qualityNote, score));
    }
    return new NoteEvaluation(note.title(), note.content(), score, expectation, issues);
  }

  static @Nullable QualityExpectation findMatchingExpectation(
      ExtractedNote note, List<QualityExpectation> expectations) {
    for (QualityExpectation expectation : expectations) {
      if (expectation.matches(note)) {
        return expectation;
      }
    }
    return null;
  }

  /** Improvement hints for every component failing on too many notes. */
  public static List<String> recommendations(NoteQualityMetrics metrics) {
    List<String> recommendations = new ArrayList<>();
    if (metrics.failureRate(NvqComponent.WHY) > FAILURE_RATE_LIMIT) {
      recommendations.add(
          "Add purpose statements (\"I am keeping this because...\") to more notes");
    }
    if (metrics.failureRate(NvqComponent.METADATA) > FAILURE_RATE_LIMIT) {
      recommendations.add("Include metadata fields (Status, Type, Stakeholder) in extraction");
    }
    if (metrics.failureRate(NvqComponent.TAXONOMY) > FAILURE_RATE_LIMIT) {
      recommendations.add("Use functional tags (#task/*, #skill/*) instead of topic tags");
    }
    if (metrics.failureRate(NvqComponent.CONNECTIVITY) > FAILURE_RATE_LIMIT) {
      recommendations.add(
          "Add upward links to projects/MOCs and sideways links to related notes");
    }
    if (metrics.failureRate(NvqComponent.ORIGINALITY) > ORIGINALITY_FAILURE_RATE_LIMIT) {
      recommendations.add("Encourage synthesis and personal interpretation over raw facts");
    }
    return recommendations;
  }
}
