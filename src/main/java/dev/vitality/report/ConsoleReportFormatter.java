package dev.vitality.report;

import dev.vitality.accuracy.ExtractionMetrics;
import dev.vitality.quality.FailureCount;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders reports as terminal text.
 *
 * <p>Percentages are green at or above 80%, yellow at or above 60% and red below; tag reuse uses
 * 90% and 70%. Colours are ANSI escapes and can be switched off with {@code
 * vitality.eval.ansi-colors=false}.
 */
@Component
public class ConsoleReportFormatter {

  private static final String RESET = "\u001b[0m";
  private static final String BRIGHT = "\u001b[1m";
  private static final String RED = "\u001b[31m";
  private static final String GREEN = "\u001b[32m";
  private static final String YELLOW = "\u001b[33m";
  private static final String BLUE = "\u001b[34m";
  private static final String MAGENTA = "\u001b[35m";
  private static final String CYAN = "\u001b[36m";

  private static final int WIDTH = 80;

  private static final Thresholds DEFAULT = new Thresholds(0.8, 0.6);
  private static final Thresholds TAG_REUSE = new Thresholds(0.9, 0.7);

  private final boolean colors;

  public ConsoleReportFormatter(@Value("${vitality.eval.ansi-colors:true}") boolean colors) {
    this.colors = colors;
  }

  private record Thresholds(double good, double ok) {}

  private record Row(String label, ToDoubleFunction<ExtractionMetrics> value, boolean millis) {}

  public String format(TestReport report) {
    StringBuilder out = new StringBuilder();
    line(out, '=', WIDTH);
    out.append(style(BRIGHT + MAGENTA, "EXTRACTION ACCURACY TEST REPORT")).append('\n');
    out.append("Run ID: ").append(report.runId()).append('\n');
    out.append("Time: ").append(report.timestamp()).append('\n');
    line(out, '=', WIDTH);

    TestReport.Summary summary = report.summary();
    out.append('\n').append(style(BRIGHT, "SUMMARY")).append('\n');
    out.append("Best Strategy: ").append(style(CYAN, summary.bestStrategy())).append('\n');
    out.append("Overall F1 Score: ")
        .append(percent(summary.overallF1Score(), DEFAULT))
        .append('\n');
    out.append("Consolidation Accuracy: ")
        .append(percent(summary.overallConsolidationAccuracy(), DEFAULT))
        .append('\n');
    out.append("Tag Reuse Rate: ")
        .append(percent(summary.overallTagReuseRate(), TAG_REUSE))
        .append('\n');

    out.append('\n').append(style(BRIGHT, "RECOMMENDATIONS")).append('\n');
    for (String recommendation : summary.recommendations()) {
      out.append("  - ").append(recommendation).append('\n');
    }

    if (report.byStrategy().size() > 1) {
      out.append(formatStrategyComparison(report.byStrategy()));
    }

    line(out, '=', WIDTH);
    out.append('\n').append(style(BRIGHT, "RESULTS BY SCENARIO")).append('\n');
    report
        .byScenario()
        .forEach(
            (scenario, byStrategy) -> {
              out.append('\n').append(style(BRIGHT + BLUE, scenario)).append('\n');
              line(out, '-', 40);
              byStrategy.forEach(
                  (strategy, metrics) ->
                      out.append("  ")
                          .append(style(CYAN, strategy))
                          .append(":\n    F1=")
                          .append(percent(metrics.duplicateDetection().f1Score(), DEFAULT))
                          .append(" Cons=")
                          .append(percent(metrics.consolidation().accuracy(), DEFAULT))
                          .append(" Tags=")
                          .append(percent(metrics.tagReuse().reuseRate(), TAG_REUSE))
                          .append('\n'));
            });

    if (report.qualitySummary() != null) {
      out.append(formatQuality(report.qualitySummary()));
    }
    line(out, '=', WIDTH);
    return out.toString();
  }

  /** Detailed block for one strategy or scenario. */
  public String formatMetrics(ExtractionMetrics metrics, String label) {
    StringBuilder out = new StringBuilder();
    out.append('\n').append(style(BRIGHT + CYAN, label)).append("\n\n");

    var dd = metrics.duplicateDetection();
    out.append(style(BRIGHT, "Duplicate Detection:")).append('\n');
    out.append("  Precision:    ").append(percent(dd.precision(), DEFAULT)).append('\n');
    out.append("  Recall:       ").append(percent(dd.recall(), DEFAULT)).append('\n');
    out.append("  F1 Score:     ").append(percent(dd.f1Score(), DEFAULT)).append('\n');
    out.append("  TP/FP/FN/TN:  ")
        .append(
            "%d/%d/%d/%d"
                .formatted(
                    dd.truePositives(),
                    dd.falsePositives(),
                    dd.falseNegatives(),
                    dd.trueNegatives()))
        .append('\n');

    var cons = metrics.consolidation();
    out.append('\n').append(style(BRIGHT, "Consolidation:")).append('\n');
    out.append("  Accuracy:     ").append(percent(cons.accuracy(), DEFAULT)).append('\n');
    out.append("  Correct:      ").append(cons.correctConsolidations()).append('\n');
    out.append("  Missed:       ").append(cons.missedConsolidations()).append('\n');
    out.append("  Wrong:        ").append(cons.wrongConsolidations()).append('\n');
    out.append("  New Notes:    ").append(cons.correctNewNotes()).append('\n');

    var tags = metrics.tagReuse();
    out.append('\n').append(style(BRIGHT, "Tag Reuse:")).append('\n');
    out.append("  Reuse Rate:   ").append(percent(tags.reuseRate(), TAG_REUSE)).append('\n');
    out.append("  Reused:       ").append(tags.reusedExisting()).append('\n');
    out.append("  Should Reuse: ").append(tags.shouldHaveReused()).append('\n');
    out.append("  New (correct):").append(tags.correctlyCreatedNew()).append('\n');

    var conn = metrics.connections();
    out.append('\n').append(style(BRIGHT, "Connections:")).append('\n');
    out.append("  Precision:    ").append(percent(conn.precision(), DEFAULT)).append('\n');
    out.append("  Recall:       ").append(percent(conn.recall(), DEFAULT)).append('\n');
    out.append("  Correct:      ").append(conn.correctConnections()).append('\n');
    out.append("  Missed:       ").append(conn.missedConnections()).append('\n');
    out.append("  Spurious:     ").append(conn.spuriousConnections()).append('\n');

    var timing = metrics.timing();
    out.append('\n').append(style(BRIGHT, "Timing:")).append('\n');
    out.append("  Total:        ").append(millis(timing.totalMs())).append('\n');
    out.append("  Context:      ").append(millis(timing.contextRetrievalMs())).append('\n');
    out.append("  Extraction:   ").append(millis(timing.extractionMs())).append('\n');
    return out.toString();
  }

  /** One column per strategy, one row per headline metric. Cells are not coloured. */
  public String formatStrategyComparison(Map<String, ExtractionMetrics> strategies) {
    List<Row> rows =
        List.of(
            new Row("Dup. F1 Score", m -> m.duplicateDetection().f1Score(), false),
            new Row("Dup. Precision", m -> m.duplicateDetection().precision(), false),
            new Row("Dup. Recall", m -> m.duplicateDetection().recall(), false),
            new Row("Cons. Accuracy", m -> m.consolidation().accuracy(), false),
            new Row("Tag Reuse Rate", m -> m.tagReuse().reuseRate(), false),
            new Row("Conn. Precision", m -> m.connections().precision(), false),
            new Row("Conn. Recall", m -> m.connections().recall(), false),
            new Row("Avg Time (ms)", m -> m.timing().totalMs(), true));

    List<String> names = new ArrayList<>(strategies.keySet());
    List<Integer> widths = new ArrayList<>();
    widths.add(20);
    names.forEach(name -> widths.add(Math.max(name.length(), 12)));

    StringBuilder out = new StringBuilder();
    out.append('\n').append(style(BRIGHT + MAGENTA, "Strategy Comparison")).append("\n\n");
    List<String> header = new ArrayList<>();
    header.add(pad("Metric", widths.get(0)));
    for (int i = 0; i < names.size(); i++) {
      header.add(pad(names.get(i), widths.get(i + 1)));
    }
    String headerLine = String.join(" | ", header);
    out.append(headerLine).append('\n');
    line(out, '-', headerLine.length());

    for (Row row : rows) {
      List<String> cells = new ArrayList<>();
      cells.add(pad(row.label(), widths.get(0)));
      for (int i = 0; i < names.size(); i++) {
        double value = row.value().applyAsDouble(strategies.get(names.get(i)));
        String formatted =
            row.millis()
                ? String.format(Locale.US, "%.0f", value)
                : String.format(Locale.US, "%.1f%%", value * 100);
        cells.add(pad(formatted, widths.get(i + 1)));
      }
      out.append(String.join(" | ", cells)).append('\n');
    }
    return out.toString();
  }

  String formatQuality(TestReport.QualitySummary quality) {
    StringBuilder out = new StringBuilder();
    line(out, '=', WIDTH);
    out.append('\n').append(style(BRIGHT, "NOTE QUALITY (NVQ)")).append('\n');
    out.append("Mean NVQ: ").append(String.format(Locale.US, "%.1f", quality.meanNvq()));
    out.append("  Median: ").append(String.format(Locale.US, "%.1f", quality.medianNvq()));
    out.append('\n');
    out.append("Passing Rate: ").append(percent(quality.passingRate(), DEFAULT)).append('\n');
    out.append("Component failure rates:\n");
    quality
        .componentFailureRates()
        .forEach(
            (component, rate) ->
                out.append("  ")
                    .append(pad(component, 13))
                    .append(": ")
                    .append(String.format(Locale.US, "%.1f%%", rate * 100))
                    .append('\n'));
    if (!quality.topIssues().isEmpty()) {
      out.append("Top issues:\n");
      for (FailureCount issue : quality.topIssues()) {
        out.append(
            "  %dx %s: %s\n".formatted(issue.count(), issue.component().key(), issue.issue()));
      }
    }
    for (String recommendation : quality.qualityRecommendations()) {
      out.append("  - ").append(recommendation).append('\n');
    }
    return out.toString();
  }

  private String percent(double value, Thresholds thresholds) {
    String text = String.format(Locale.US, "%.1f%%", value * 100);
    if (value >= thresholds.good()) {
      return style(GREEN, text);
    } else if (value >= thresholds.ok()) {
      return style(YELLOW, text);
    }
    return style(RED, text);
  }

  private String style(String codes, String text) {
    return colors ? codes + text + RESET : text;
  }

  private static String millis(double value) {
    return String.format(Locale.US, "%.0fms", value);
  }

  private static String pad(String value, int width) {
    return value.length() >= width ? value : " ".repeat(width - value.length()) + value;
  }

  private static void line(StringBuilder out, char c, int width) {
    out.append(String.valueOf(c).repeat(width)).append('\n');
  }
}
