package dev.vitality.nvq;

import java.util.List;

/**
 * Immutable inputs for {@link NvqEvaluator}.
 *
 * @param mocs names of Maps of Content; a link whose target contains one counts as upward
 * @param projects project names; a link whose target contains one counts as upward
 * @param goals personal goals for the purpose-to-goal check
 * @param passingThreshold minimum total for a passing note
 */
public record NvqEvaluatorConfig(
    List<String> mocs, List<String> projects, List<Goal> goals, int passingThreshold) {

  public static final int DEFAULT_PASSING_THRESHOLD = 7;

  public NvqEvaluatorConfig {
    if (passingThreshold < 0) {
      throw new IllegalArgumentException(
          "passingThreshold must not be negative, got: " + passingThreshold);
    }
    mocs = mocs == null ? List.of() : List.copyOf(mocs);
    projects = projects == null ? List.of() : List.copyOf(projects);
    goals = goals == null ? List.of() : List.copyOf(goals);
  }

  /** No MOCs, projects or goals, and the default threshold of 7. */
  public static NvqEvaluatorConfig defaults() {
    return new NvqEvaluatorConfig(List.of(), List.of(), List.of(), DEFAULT_PASSING_THRESHOLD);
  }

  public NvqEvaluatorConfig withPassingThreshold(int threshold) {
    return new NvqEvaluatorConfig(mocs, projects, goals, threshold);
  }

  public NvqEvaluatorConfig withUpwardTargets(List<String> mocs, List<String> projects) {
    return new NvqEvaluatorConfig(mocs, projects, goals, passingThreshold);
  }
}
