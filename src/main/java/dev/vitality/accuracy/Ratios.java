package dev.vitality.accuracy;

/** Ratio helpers shared by every metric, with explicit zero-denominator defaults. */
public final class Ratios {

  private Ratios() {}

  /** {@code numerator / denominator}, or {@code ifEmpty} when the denominator is 0. */
  public static double ratio(long numerator, long denominator, double ifEmpty) {
    return denominator > 0 ? (double) numerator / denominator : ifEmpty;
  }

  /** Harmonic mean of precision and recall; 0 when both are 0. */
  public static double f1(double precision, double recall) {
    double sum = precision + recall;
    return sum > 0 ? 2 * precision * recall / sum : 0.0;
  }
}
