package dev.vitality.accuracy;

/**
 * Confusion counts for merge decisions. A positive is "should merge into an existing note".
 *
 * <p>Precision and recall are 1 when their denominators are 0; F1 is 0 when both are 0.
 */
public record DuplicateDetectionMetrics(
    int truePositives,
    int falsePositives,
    int falseNegatives,
    int trueNegatives,
    double precision,
    double recall,
    double f1Score) {

  public static DuplicateDetectionMetrics fromCounts(int tp, int fp, int fn, int tn) {
    double precision = Ratios.ratio(tp, tp + fp, 1.0);
    double recall = Ratios.ratio(tp, tp + fn, 1.0);
    return new DuplicateDetectionMetrics(
        tp, fp, fn, tn, precision, recall, Ratios.f1(precision, recall));
  }
}
