package dev.vitality.quality;

import dev.vitality.nvq.NvqEvaluatorConfig;

/**
 * Per-call settings for a quality evaluation.
 *
 * @param scenarioName label carried into the results
 * @param config rubric configuration: upward targets, goals and passing threshold
 */
public record QualityOptions(String scenarioName, NvqEvaluatorConfig config) {

  public QualityOptions {
    scenarioName = scenarioName == null || scenarioName.isBlank() ? "unnamed" : scenarioName;
    config = config == null ? NvqEvaluatorConfig.defaults() : config;
  }

  public static QualityOptions defaults() {
    return new QualityOptions("unnamed", NvqEvaluatorConfig.defaults());
  }
}
