package dev.vitality.quality;

import dev.vitality.nvq.NvqComponent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate NVQ statistics over a set of notes.
 *
 * <p>Maps are keyed by {@link NvqComponent#key()}. Every histogram holds a bucket for each score
 * from 0 to the component maximum, so empty buckets read as 0.
 *
 * @param medianNvq the upper median: the element at index {@code n / 2} of the sorted totals
 * @param failureRates share of notes scoring 0 on each component
 * @param notesWithFunctionalTags notes with more functional than topic tags
 * @param topFailures the ten most frequent failure reasons, most frequent first
 */
public record NoteQualityMetrics(
    double meanNvq,
    double medianNvq,
    int minNvq,
    int maxNvq,
    double passingRate,
    Map<String, Double> failureRates,
    Map<String, Map<Integer, Integer>> scoreDistributions,
    int totalNotesEvaluated,
    int notesWithPurpose,
    int notesWithCompleteMetadata,
    int notesWithFunctionalTags,
    int notesWithTwoLinks,
    int notesThatAreSynthesis,
    List<FailureCount> topFailures) {

  public NoteQualityMetrics {
    failureRates = Collections.unmodifiableMap(new LinkedHashMap<>(failureRates));
    Map<String, Map<Integer, Integer>> copy = new LinkedHashMap<>();
    scoreDistributions.forEach(
        (key, histogram) ->
            copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(histogram))));
    scoreDistributions = Collections.unmodifiableMap(copy);
    topFailures = List.copyOf(topFailures);
  }

  public static NoteQualityMetrics empty() {
    Map<String, Double> rates = new LinkedHashMap<>();
    Map<String, Map<Integer, Integer>> histograms = new LinkedHashMap<>();
    for (NvqComponent component : NvqComponent.values()) {
      rates.put(component.key(), 0.0);
      histograms.put(component.key(), QualityMetricsCalculator.emptyHistogram(component));
    }
    return new NoteQualityMetrics(0, 0, 0, 0, 0, rates, histograms, 0, 0, 0, 0, 0, 0, List.of());
  }

  public double failureRate(NvqComponent component) {
    return failureRates.getOrDefault(component.key(), 0.0);
  }

  public Map<Integer, Integer> distribution(NvqComponent component) {
    return scoreDistributions.getOrDefault(component.key(), Map.of());
  }
}
