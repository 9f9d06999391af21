package dev.vitality.report;

import java.util.Locale;

/**
 * Fixed key=value summary for CI pipelines. {@code STATUS=PASS} iff the overall F1 is at least
 * 0.7; percentages carry one decimal.
 */
public final class CiSummaryFormatter {

  public static final double PASSING_F1 = 0.7;

  private CiSummaryFormatter() {}

  public static String format(TestReport report) {
    TestReport.Summary summary = report.summary();
    return String.join(
            "\n",
            "EXTRACTION_ACCURACY_TEST_RESULTS",
            "STATUS=" + (passed(report) ? "PASS" : "FAIL"),
            "BEST_STRATEGY=" + summary.bestStrategy(),
            "F1_SCORE=" + percent(summary.overallF1Score()),
            "CONSOLIDATION_ACCURACY=" + percent(summary.overallConsolidationAccuracy()),
            "TAG_REUSE_RATE=" + percent(summary.overallTagReuseRate()))
        + "\n";
  }

  public static boolean passed(TestReport report) {
    return report.summary().overallF1Score() >= PASSING_F1;
  }

  private static String percent(double value) {
    return String.format(Locale.US, "%.1f", value * 100);
  }
}
