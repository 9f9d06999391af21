package dev.vitality.runner;

import dev.vitality.accuracy.AccuracyCalculator;
import dev.vitality.accuracy.ExtractionMetrics;
import dev.vitality.accuracy.MetricsAggregator;
import dev.vitality.accuracy.TestScenario;
import dev.vitality.nvq.NvqProperties;
import dev.vitality.quality.QualityEvaluationResults;
import dev.vitality.quality.QualityEvaluationService;
import dev.vitality.quality.QualityOptions;
import dev.vitality.report.ScenarioResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates every run of a suite against its scenario and aggregates the results per strategy.
 *
 * <p>A run naming an unknown scenario is kept in the results with an error and empty metrics, and
 * is left out of its strategy's aggregate.
 */
@Service
public class AccuracyEvaluationService {

  private static final Logger log = LoggerFactory.getLogger(AccuracyEvaluationService.class);

  private final AccuracyCalculator calculator;
  private final QualityEvaluationService qualityService;
  private final NvqProperties nvqProperties;

  public AccuracyEvaluationService(
      AccuracyCalculator calculator,
      QualityEvaluationService qualityService,
      NvqProperties nvqProperties) {
    this.calculator = calculator;
    this.qualityService = qualityService;
    this.nvqProperties = nvqProperties;
  }

  public EvaluationOutcome evaluate(EvaluationSuite suite) {
    List<ScenarioResult> results = new ArrayList<>(suite.runs().size());
    Map<String, List<ExtractionMetrics>> byStrategy = new LinkedHashMap<>();

    for (ExtractionRun run : suite.runs()) {
      Optional<TestScenario> scenario = suite.scenario(run.scenarioName());
      if (scenario.isEmpty()) {
        log.warn(
            "Run of strategy '{}' references unknown scenario '{}'",
            run.strategyName(),
            run.scenarioName());
        List<String> errors = new ArrayList<>(run.errors());
        errors.add("Unknown scenario: " + run.scenarioName());
        results.add(
            new ScenarioResult(
                run.scenarioName(),
                run.strategyName(),
                ExtractionMetrics.empty(),
                run.extractedNotes(),
                errors,
                null));
        byStrategy.computeIfAbsent(run.strategyName(), k -> new ArrayList<>());
        continue;
      }

      ScenarioResult result = evaluateRun(run, scenario.get());
      results.add(result);
      byStrategy.computeIfAbsent(run.strategyName(), k -> new ArrayList<>()).add(result.metrics());
    }

    Map<String, ExtractionMetrics> strategyMetrics = new LinkedHashMap<>();
    byStrategy.forEach(
        (strategy, metrics) -> strategyMetrics.put(strategy, MetricsAggregator.aggregate(metrics)));
    log.info(
        "Evaluated {} runs across {} strategies", results.size(), strategyMetrics.size());
    return new EvaluationOutcome(results, Collections.unmodifiableMap(strategyMetrics));
  }

  ScenarioResult evaluateRun(ExtractionRun run, TestScenario scenario) {
    ExtractionMetrics metrics = calculator.calculate(run.extractedNotes(), scenario, run.timing());
    log.debug(
        "Scenario '{}' / strategy '{}': f1={}, consolidation={}, tagReuse={}",
        scenario.name(),
        run.strategyName(),
        metrics.duplicateDetection().f1Score(),
        metrics.consolidation().accuracy(),
        metrics.tagReuse().reuseRate());

    QualityEvaluationResults quality = null;
    if (scenario.hasQualityExpectations()) {
      quality =
          qualityService.evaluateQuality(
              run.extractedNotes(),
              scenario.qualityExpectations(),
              new QualityOptions(
                  scenario.name() + " / " + run.strategyName(), nvqProperties.toConfig()));
    }
    return new ScenarioResult(
        scenario.name(), run.strategyName(), metrics, run.extractedNotes(), run.errors(), quality);
  }
}
