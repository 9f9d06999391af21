package dev.vitality.quality;

import java.util.List;

/** Quality evaluation of one scenario's notes. */
public record QualityEvaluationResults(
    String scenarioName,
    List<NoteEvaluation> noteResults,
    NoteQualityMetrics aggregateMetrics,
    List<String> recommendations) {

  public QualityEvaluationResults {
    noteResults = List.copyOf(noteResults);
    recommendations = List.copyOf(recommendations);
  }
}
