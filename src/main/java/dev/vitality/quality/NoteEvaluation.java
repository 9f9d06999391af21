package dev.vitality.quality;

import dev.vitality.nvq.NvqScore;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * NVQ outcome for one note.
 *
 * @param matchedExpectation first expectation the note matched, or null
 * @param issues threshold failure, one line per failing component, then expectation mismatches
 */
public record NoteEvaluation(
    String noteTitle,
    String noteContent,
    NvqScore nvqScore,
    @Nullable QualityExpectation matchedExpectation,
    List<String> issues) {

  public NoteEvaluation {
    issues = List.copyOf(issues);
  }
}
