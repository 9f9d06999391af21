package dev.vitality.nvq;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised NVQ rubric configuration.
 *
 * <p>Properties are bound from {@code vitality.nvq.*} in application.yml.
 *
 * <ul>
 *   <li>{@code passing-threshold} - minimum total for a passing note (default 7, must not be negative)
 *   <li>{@code mocs} - Map of Content names treated as upward link targets
 *   <li>{@code projects} - project names treated as upward link targets
 *   <li>{@code goals} - personal goals ({@code title}, {@code why-root}) for the goal-link check
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "vitality.nvq")
public class NvqProperties {

  private int passingThreshold = NvqEvaluatorConfig.DEFAULT_PASSING_THRESHOLD;
  private List<String> mocs = new ArrayList<>();
  private List<String> projects = new ArrayList<>();
  private List<GoalEntry> goals = new ArrayList<>();

  @PostConstruct
  void validate() {
    if (passingThreshold < 0) {
      throw new IllegalStateException(
          "vitality.nvq.passing-threshold must not be negative, got: " + passingThreshold);
    }
    for (GoalEntry goal : goals) {
      if (goal.getTitle() == null || goal.getTitle().isBlank()) {
        throw new IllegalStateException("vitality.nvq.goals entries need a non-blank title");
      }
    }
  }

  /** Snapshot of these properties as an immutable evaluator config. */
  public NvqEvaluatorConfig toConfig() {
    List<Goal> converted =
        goals.stream().map(g -> new Goal(g.getTitle(), g.getWhyRoot())).toList();
    return new NvqEvaluatorConfig(mocs, projects, converted, passingThreshold);
  }

  public int getPassingThreshold() {
    return passingThreshold;
  }

  public void setPassingThreshold(int passingThreshold) {
    this.passingThreshold = passingThreshold;
  }

  public List<String> getMocs() {
    return mocs;
  }

  public void setMocs(List<String> mocs) {
    this.mocs = mocs;
  }

  public List<String> getProjects() {
    return projects;
  }

  public void setProjects(List<String> projects) {
    this.projects = projects;
  }

  public List<GoalEntry> getGoals() {
    return goals;
  }

  public void setGoals(List<GoalEntry> goals) {
    this.goals = goals;
  }

  /** Mutable binding target for one {@code vitality.nvq.goals} entry. */
  public static class GoalEntry {

    private String title = "";
    private String whyRoot = "";

    public String getTitle() {
      return title;
    }

    public void setTitle(String title) {
      this.title = title;
    }

    public String getWhyRoot() {
      return whyRoot;
    }

    public void setWhyRoot(String whyRoot) {
      this.whyRoot = whyRoot;
    }
  }
}
