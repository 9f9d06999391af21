package dev.vitality.accuracy;

/** Connection correctness; precision and recall are 1 on empty denominators. */
public record ConnectionMetrics(
    int correctConnections,
    int missedConnections,
    int spuriousConnections,
    double precision,
    double recall) {

  public static ConnectionMetrics fromCounts(int correct, int missed, int spurious) {
    return new ConnectionMetrics(
        correct,
        missed,
        spurious,
        Ratios.ratio(correct, correct + spurious, 1.0),
        Ratios.ratio(correct, correct + missed, 1.0));
  }
}
