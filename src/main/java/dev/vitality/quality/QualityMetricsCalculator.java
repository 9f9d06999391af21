package dev.vitality.quality;

import dev.vitality.nvq.FailureReasons;
import dev.vitality.nvq.NvqBreakdown;
import dev.vitality.nvq.NvqComponent;
import dev.vitality.nvq.NvqScore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reduces individual NVQ scores to {@link NoteQualityMetrics}. */
public final class QualityMetricsCalculator {

  static final int TOP_FAILURES = 10;

  private QualityMetricsCalculator() {}

  public static NoteQualityMetrics calculate(List<NvqScore> scores) {
    if (scores.isEmpty()) {
      return NoteQualityMetrics.empty();
    }
    int n = scores.size();
    int[] totals = scores.stream().mapToInt(NvqScore::total).sorted().toArray();
    double mean = scores.stream().mapToInt(NvqScore::total).average().orElse(0);
    long passing = scores.stream().filter(NvqScore::passing).count();

    Map<String, Double> failureRates = new LinkedHashMap<>();
    Map<String, Map<Integer, Integer>> histograms = new LinkedHashMap<>();
    for (NvqComponent component : NvqComponent.values()) {
      Map<Integer, Integer> histogram = emptyHistogram(component);
      int failures = 0;
      for (NvqScore score : scores) {
        int value = score.breakdown().scoreOf(component);
        histogram.merge(value, 1, Integer::sum);
        if (value == 0) {
          failures++;
        }
      }
      failureRates.put(component.key(), (double) failures / n);
      histograms.put(component.key(), histogram);
    }

    int withPurpose = 0;
    int withMetadata = 0;
    int withFunctionalTags = 0;
    int withTwoLinks = 0;
    int synthesis = 0;
    for (NvqScore score : scores) {
      NvqBreakdown b = score.breakdown();
      if (b.why().rawStatement() != null) {
        withPurpose++;
      }
      if (b.metadata().fieldsPresent() >= 3) {
        withMetadata++;
      }
      if (b.taxonomy().functionalTags() > b.taxonomy().topicTags()) {
        withFunctionalTags++;
      }
      if (b.connectivity().meetsMinimum()) {
        withTwoLinks++;
      }
      if (b.originality().hasOriginalInsight()) {
        synthesis++;
      }
    }

    return new NoteQualityMetrics(
        mean,
        totals[n / 2],
        totals[0],
        totals[n - 1],
        (double) passing / n,
        failureRates,
        histograms,
        n,
        withPurpose,
        withMetadata,
        withFunctionalTags,
        withTwoLinks,
        synthesis,
        topFailures(scores));
  }

  /** Most frequent (component, reason) pairs; ties keep first-seen order. */
  static List<FailureCount> topFailures(List<NvqScore> scores) {
    Map<NvqComponent, Map<String, Integer>> counts = new LinkedHashMap<>();
    for (NvqScore score : scores) {
      for (NvqComponent component : score.failingComponents()) {
        counts
            .computeIfAbsent(component, c -> new LinkedHashMap<>())
            .merge(FailureReasons.reasonFor(score, component), 1, Integer::sum);
      }
    }
    List<FailureCount> failures = new ArrayList<>();
    counts.forEach(
        (component, reasons) ->
            reasons.forEach(
                (reason, count) -> failures.add(new FailureCount(component, reason, count))));
    failures.sort(Comparator.comparingInt(FailureCount::count).reversed());
    return failures.size() > TOP_FAILURES ? failures.subList(0, TOP_FAILURES) : failures;
  }

  static Map<Integer, Integer> emptyHistogram(NvqComponent component) {
    Map<Integer, Integer> histogram = new LinkedHashMap<>();
    for (int score = 0; score <= component.maxScore(); score++) {
      histogram.put(score, 0);
    }
    return histogram;
  }
}
