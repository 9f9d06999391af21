package dev.vitality.runner;

import dev.vitality.accuracy.Timing;
import dev.vitality.note.ExtractedNote;
import java.util.List;
import java.util.Objects;

/**
 * One strategy's extraction output for one scenario, as recorded by the upstream pipeline.
 *
 * @param errors errors the pipeline reported while extracting
 */
public record ExtractionRun(
    String scenarioName,
    String strategyName,
    List<ExtractedNote> extractedNotes,
    Timing timing,
    List<String> errors) {

  public ExtractionRun {
    if (strategyName == null || strategyName.isBlank()) {
      throw new IllegalArgumentException("strategyName must not be blank");
    }
    scenarioName = scenarioName == null ? "" : scenarioName;
    extractedNotes =
        extractedNotes == null
            ? List.of()
            : extractedNotes.stream().filter(Objects::nonNull).toList();
    timing = timing == null ? Timing.ZERO : timing;
    errors = errors == null ? List.of() : errors.stream().filter(Objects::nonNull).toList();
  }
}
