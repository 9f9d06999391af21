package dev.vitality.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vitality.accuracy.AccuracyCalculator;
import dev.vitality.accuracy.ExtractionMetrics;
import dev.vitality.accuracy.GroundTruth;
import dev.vitality.accuracy.PatternNoteMatcher;
import dev.vitality.accuracy.TagReuseRules;
import dev.vitality.fixture.SampleMetrics;
import dev.vitality.nvq.NvqEvaluator;
import dev.vitality.nvq.NvqProperties;
import dev.vitality.parse.NoteFieldParser;
import dev.vitality.quality.QualityEvaluationService;
import dev.vitality.report.ConsoleReportFormatter;
import dev.vitality.report.ReportExporter;
import dev.vitality.report.ReportGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

@SuppressWarnings("NullAway.Init")
class EvaluationCommandRunnerTest {

  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-02-21T14:30:00Z"), ZoneId.of("UTC"));

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private EvalProperties properties;
  private ReportExporter exporter;

  @BeforeEach
  void setUp() {
    properties = new EvalProperties();
    exporter = new ReportExporter(tempDir.toString(), objectMapper);
  }

  private AccuracyEvaluationService realEvaluationService() {
    AccuracyCalculator calculator =
        new AccuracyCalculator(new GroundTruth(new PatternNoteMatcher(), TagReuseRules.defaults()));
    QualityEvaluationService quality =
        new QualityEvaluationService(new NvqEvaluator(new NoteFieldParser()));
    return new AccuracyEvaluationService(calculator, quality, new NvqProperties());
  }

  private EvaluationCommandRunner runner(
      SuiteLoader loader, AccuracyEvaluationService evaluationService) {
    return new EvaluationCommandRunner(
        loader,
        evaluationService,
        new ReportGenerator(FIXED_CLOCK),
        new ConsoleReportFormatter(false),
        exporter,
        properties,
        new PrintStream(buffer, true, StandardCharsets.UTF_8));
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  private EvaluationCommandRunner stubbedRunner(Map<String, ExtractionMetrics> strategies)
      throws IOException {
    SuiteLoader loader = mock(SuiteLoader.class);
    AccuracyEvaluationService evaluationService = mock(AccuracyEvaluationService.class);
    EvaluationSuite suite = new EvaluationSuite(List.of(), List.of());
    when(loader.load(properties.getSuiteLocation())).thenReturn(suite);
    when(evaluationService.evaluate(suite))
        .thenReturn(new EvaluationOutcome(List.of(), strategies));
    return runner(loader, evaluationService);
  }

  @Test
  void sample_suite_in_ci_mode_prints_summary_and_exports() throws IOException {
    properties.setCiMode(true);
    properties.getThresholds().setF1(0.0);
    properties.getThresholds().setConsolidationAccuracy(0.0);
    properties.getThresholds().setTagReuseRate(0.0);
    EvaluationCommandRunner runner =
        runner(new SuiteLoader(objectMapper), realEvaluationService());

    runner.run(new DefaultApplicationArguments());

    assertThat(output()).startsWith("EXTRACTION_ACCURACY_TEST_RESULTS\nSTATUS=");
    assertThat(output()).containsPattern("BEST_STRATEGY=(keyword|hybrid)");
    assertThat(runner.getExitCode()).isZero();
    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .containsExactlyInAnyOrder(
              "extraction-accuracy-run-1771684200000.json",
              "extraction-accuracy-run-1771684200000-strategies.csv");
    }
  }

  @Test
  void console_mode_prints_full_report() throws IOException {
    EvaluationCommandRunner runner = stubbedRunner(Map.of("hybrid", SampleMetrics.perfect()));

    runner.run(new DefaultApplicationArguments());

    assertThat(output())
        .contains("EXTRACTION ACCURACY TEST REPORT")
        .contains("Best Strategy: hybrid");
    assertThat(runner.getExitCode()).isZero();
  }

  @Test
  void missed_threshold_sets_exit_code_one() throws IOException {
    EvaluationCommandRunner runner = stubbedRunner(Map.of("keyword", SampleMetrics.partial()));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(1);
  }

  @Test
  void tag_reuse_threshold_is_enforced_too() throws IOException {
    EvaluationCommandRunner runner = stubbedRunner(Map.of("strict", SampleMetrics.noTagReuse()));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(1);
  }

  @Test
  void unreadable_suite_sets_exit_code_one_without_output() throws IOException {
    properties.setSuiteLocation(tempDir.resolve("absent.json").toString());
    EvaluationCommandRunner runner =
        runner(new SuiteLoader(objectMapper), realEvaluationService());

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(1);
    assertThat(output()).isEmpty();
  }
}
