package dev.vitality.accuracy;

import java.util.List;

/**
 * Combines per-run metrics by summing raw counts and recomputing every ratio from the sums.
 *
 * <p>Ratios are never averaged, so aggregating a list with itself leaves every ratio unchanged.
 * Timings are averaged.
 */
public final class MetricsAggregator {

  private MetricsAggregator() {}

  public static ExtractionMetrics aggregate(List<ExtractionMetrics> results) {
    if (results.isEmpty()) {
      return ExtractionMetrics.empty();
    }

    int tp = 0;
    int fp = 0;
    int fn = 0;
    int tn = 0;
    int correct = 0;
    int missed = 0;
    int wrong = 0;
    int newNotes = 0;
    int reused = 0;
    int createdNew = 0;
    int shouldReuse = 0;
    int tagsAssigned = 0;
    int connCorrect = 0;
    int connMissed = 0;
    int connSpurious = 0;
    double totalMs = 0;
    double contextMs = 0;
    double extractionMs = 0;

    for (ExtractionMetrics r : results) {
      DuplicateDetectionMetrics dd = r.duplicateDetection();
      tp += dd.truePositives();
      fp += dd.falsePositives();
      fn += dd.falseNegatives();
      tn += dd.trueNegatives();

      ConsolidationMetrics cons = r.consolidation();
      correct += cons.correctConsolidations();
      missed += cons.missedConsolidations();
      wrong += cons.wrongConsolidations();
      newNotes += cons.correctNewNotes();

      TagReuseMetrics tags = r.tagReuse();
      reused += tags.reusedExisting();
      createdNew += tags.correctlyCreatedNew();
      shouldReuse += tags.shouldHaveReused();
      tagsAssigned += tags.totalTagsAssigned();

      ConnectionMetrics conn = r.connections();
      connCorrect += conn.correctConnections();
      connMissed += conn.missedConnections();
      connSpurious += conn.spuriousConnections();

      totalMs += r.timing().totalMs();
      contextMs += r.timing().contextRetrievalMs();
      extractionMs += r.timing().extractionMs();
    }

    int n = results.size();
    return new ExtractionMetrics(
        DuplicateDetectionMetrics.fromCounts(tp, fp, fn, tn),
        ConsolidationMetrics.fromCounts(correct, missed, wrong, newNotes),
        TagReuseMetrics.fromCounts(reused, createdNew, shouldReuse, tagsAssigned),
        ConnectionMetrics.fromCounts(connCorrect, connMissed, connSpurious),
        new Timing(totalMs / n, contextMs / n, extractionMs / n));
  }
}
