package dev.vitality.runner;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for suite evaluation runs.
 *
 * <p>Properties are bound from {@code vitality.eval.*} in application.yml.
 *
 * <ul>
 *   <li>{@code suite-location} - {@code classpath:} resource or filesystem path of the suite JSON
 *   <li>{@code run-on-startup} - evaluate the suite when the application starts (default false)
 *   <li>{@code ci-mode} - print the key=value CI summary instead of the console report
 *   <li>{@code thresholds.*} - minimum F1, consolidation accuracy and tag reuse rate for a zero
 *       exit status (defaults 0.7, 0.7, 0.8)
 * </ul>
 *
 * <p>{@code output-dir} and {@code ansi-colors} are read directly by the report beans.
 */
@Configuration
@ConfigurationProperties(prefix = "vitality.eval")
public class EvalProperties {

  private String suiteLocation = "classpath:eval/sample-suite.json";
  private boolean runOnStartup = false;
  private boolean ciMode = false;
  private final Thresholds thresholds = new Thresholds();

  @PostConstruct
  void validate() {
    if (suiteLocation == null || suiteLocation.isBlank()) {
      throw new IllegalStateException("vitality.eval.suite-location must not be blank");
    }
    checkUnit("f1", thresholds.getF1());
    checkUnit("consolidation-accuracy", thresholds.getConsolidationAccuracy());
    checkUnit("tag-reuse-rate", thresholds.getTagReuseRate());
  }

  private static void checkUnit(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalStateException(
          "vitality.eval.thresholds." + name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  public String getSuiteLocation() {
    return suiteLocation;
  }

  public void setSuiteLocation(String suiteLocation) {
    this.suiteLocation = suiteLocation;
  }

  public boolean isRunOnStartup() {
    return runOnStartup;
  }

  public void setRunOnStartup(boolean runOnStartup) {
    this.runOnStartup = runOnStartup;
  }

  public boolean isCiMode() {
    return ciMode;
  }

  public void setCiMode(boolean ciMode) {
    this.ciMode = ciMode;
  }

  public Thresholds getThresholds() {
    return thresholds;
  }

  /** Minimum headline metrics of the best strategy. */
  public static class Thresholds {

    private double f1 = 0.7;
    private double consolidationAccuracy = 0.7;
    private double tagReuseRate = 0.8;

    public double getF1() {
      return f1;
    }

    public void setF1(double f1) {
      this.f1 = f1;
    }

    public double getConsolidationAccuracy() {
      return consolidationAccuracy;
    }

    public void setConsolidationAccuracy(double consolidationAccuracy) {
      this.consolidationAccuracy = consolidationAccuracy;
    }

    public double getTagReuseRate() {
      return tagReuseRate;
    }

    public void setTagReuseRate(double tagReuseRate) {
      this.tagReuseRate = tagReuseRate;
    }
  }
}
