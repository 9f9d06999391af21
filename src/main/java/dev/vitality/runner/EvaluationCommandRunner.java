package dev.vitality.runner;

import dev.vitality.report.CiSummaryFormatter;
import dev.vitality.report.ConsoleReportFormatter;
import dev.vitality.report.ReportExporter;
import dev.vitality.report.ReportGenerator;
import dev.vitality.report.TestReport;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Evaluates the configured suite at startup, prints the report and exports it.
 *
 * <p>The exit code is 0 when the best strategy meets every threshold in {@link
 * EvalProperties.Thresholds}, 1 when it misses one or the suite cannot be read or the report
 * cannot be written.
 */
@Component
@ConditionalOnProperty(prefix = "vitality.eval", name = "run-on-startup", havingValue = "true")
public class EvaluationCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(EvaluationCommandRunner.class);

  private final SuiteLoader suiteLoader;
  private final AccuracyEvaluationService evaluationService;
  private final ReportGenerator reportGenerator;
  private final ConsoleReportFormatter consoleFormatter;
  private final ReportExporter reportExporter;
  private final EvalProperties properties;
  private final PrintStream out;

  private int exitCode = 0;

  @Autowired
  public EvaluationCommandRunner(
      SuiteLoader suiteLoader,
      AccuracyEvaluationService evaluationService,
      ReportGenerator reportGenerator,
      ConsoleReportFormatter consoleFormatter,
      ReportExporter reportExporter,
      EvalProperties properties) {
    this(
        suiteLoader,
        evaluationService,
        reportGenerator,
        consoleFormatter,
        reportExporter,
        properties,
        System.out);
  }

  EvaluationCommandRunner(
      SuiteLoader suiteLoader,
      AccuracyEvaluationService evaluationService,
      ReportGenerator reportGenerator,
      ConsoleReportFormatter consoleFormatter,
      ReportExporter reportExporter,
      EvalProperties properties,
      PrintStream out) {
    this.suiteLoader = suiteLoader;
    this.evaluationService = evaluationService;
    this.reportGenerator = reportGenerator;
    this.consoleFormatter = consoleFormatter;
    this.reportExporter = reportExporter;
    this.properties = properties;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    String location = properties.getSuiteLocation();
    try {
      EvaluationSuite suite = suiteLoader.load(location);
      EvaluationOutcome outcome = evaluationService.evaluate(suite);
      TestReport report = reportGenerator.generate(outcome.results(), outcome.strategyMetrics());

      out.print(
          properties.isCiMode()
              ? CiSummaryFormatter.format(report)
              : consoleFormatter.format(report));

      List<Path> written = reportExporter.export(report);
      log.info("Report {} written to {}", report.runId(), written);

      exitCode = meetsThresholds(report.summary()) ? 0 : 1;
      if (exitCode != 0) {
        log.warn(
            "Best strategy '{}' misses accuracy thresholds", report.summary().bestStrategy());
      }
    } catch (IOException e) {
      log.error("Evaluation of suite '{}' failed", location, e);
      exitCode = 1;
    }
  }

  boolean meetsThresholds(TestReport.Summary summary) {
    EvalProperties.Thresholds thresholds = properties.getThresholds();
    return summary.overallF1Score() >= thresholds.getF1()
        && summary.overallConsolidationAccuracy() >= thresholds.getConsolidationAccuracy()
        && summary.overallTagReuseRate() >= thresholds.getTagReuseRate();
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
