package dev.vitality.accuracy;

/** Merge correctness; {@code accuracy} is 1 when nothing was counted. */
public record ConsolidationMetrics(
    int correctConsolidations,
    int missedConsolidations,
    int wrongConsolidations,
    int correctNewNotes,
    double accuracy) {

  public static ConsolidationMetrics fromCounts(int correct, int missed, int wrong, int newNotes) {
    int total = correct + missed + wrong + newNotes;
    return new ConsolidationMetrics(
        correct, missed, wrong, newNotes, Ratios.ratio(correct + newNotes, total, 1.0));
  }

  public int total() {
    return correctConsolidations + missedConsolidations + wrongConsolidations + correctNewNotes;
  }
}
