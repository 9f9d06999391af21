package dev.vitality.accuracy;

/** All accuracy metrics for one extraction run, or an aggregate of several. */
public record ExtractionMetrics(
    DuplicateDetectionMetrics duplicateDetection,
    ConsolidationMetrics consolidation,
    TagReuseMetrics tagReuse,
    ConnectionMetrics connections,
    Timing timing) {

  /** Zero counts with every ratio at its empty default. */
  public static ExtractionMetrics empty() {
    return new ExtractionMetrics(
        DuplicateDetectionMetrics.fromCounts(0, 0, 0, 0),
        ConsolidationMetrics.fromCounts(0, 0, 0, 0),
        TagReuseMetrics.fromCounts(0, 0, 0, 0),
        ConnectionMetrics.fromCounts(0, 0, 0),
        Timing.ZERO);
  }
}
