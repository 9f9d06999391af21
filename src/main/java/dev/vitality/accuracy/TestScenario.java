package dev.vitality.accuracy;

import dev.vitality.quality.QualityExpectation;
import java.util.List;
import java.util.Objects;

/**
 * One evaluation case: the knowledge base before extraction and everything the extraction is
 * expected to produce from it.
 */
public record TestScenario(
    String name,
    String description,
    List<ExpectedNote> expectedNotes,
    List<ExpectedConsolidation> expectedConsolidations,
    List<ExistingNote> existingNotes,
    List<String> existingTags,
    List<QualityExpectation> qualityExpectations) {

  public TestScenario {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Scenario name must not be blank");
    }
    description = description == null ? "" : description;
    expectedNotes =
        expectedNotes == null
            ? List.of()
            : expectedNotes.stream().filter(Objects::nonNull).toList();
    expectedConsolidations =
        expectedConsolidations == null
            ? List.of()
            : expectedConsolidations.stream().filter(Objects::nonNull).toList();
    existingNotes =
        existingNotes == null
            ? List.of()
            : existingNotes.stream().filter(Objects::nonNull).toList();
    existingTags =
        existingTags == null
            ? List.of()
            : existingTags.stream().filter(Objects::nonNull).toList();
    qualityExpectations =
        qualityExpectations == null
            ? List.of()
            : qualityExpectations.stream().filter(Objects::nonNull).toList();
  }

  public boolean hasQualityExpectations() {
    return !qualityExpectations.isEmpty();
  }
}
