package dev.vitality.accuracy;

import static org.assertj.core.api.Assertions.assertThat;

import dev.vitality.fixture.ExtractedNoteBuilder;
import dev.vitality.note.ExtractedNote;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GroundTruthTest {

  private static final List<ExistingNote> EXISTING =
      List.of(
          new ExistingNote("n1", "Morning Routine", "Wake at six", List.of("habits")),
          new ExistingNote("n2", "Deep Work", "Focus blocks", List.of("focus")));

  private static final List<ExpectedConsolidation> CONSOLIDATIONS =
      List.of(
          new ExpectedConsolidation("cold shower|morning routine", "Morning Routine", List.of()),
          new ExpectedConsolidation("shower", "Deep Work", List.of()));

  private final GroundTruth groundTruth =
      new GroundTruth(new PatternNoteMatcher(), TagReuseRules.defaults());

  @Nested
  class Consolidation {

    @Test
    void merge_into_expected_target_is_correct_ignoring_case() {
      ExtractedNote note =
          new ExtractedNoteBuilder()
              .content("Added a cold shower to the start of the day")
              .consolidatedWith("morning routine")
              .build();

      ConsolidationCheck check = groundTruth.checkConsolidation(note, EXISTING, CONSOLIDATIONS);

      assertThat(check.shouldHaveConsolidated()).isTrue();
      assertThat(check.didConsolidate()).isTrue();
      assertThat(check.consolidatedCorrectly()).isTrue();
      assertThat(check.expectedTarget()).isEqualTo("Morning Routine");
      assertThat(check.expectationIndex()).isZero();
    }

    @Test
    void first_matching_expectation_wins() {
      ExtractedNote note =
          new ExtractedNoteBuilder()
              .content("cold shower again")
              .consolidatedWith("Deep Work")
              .build();

      ConsolidationCheck check = groundTruth.checkConsolidation(note, EXISTING, CONSOLIDATIONS);

      assertThat(check.expectationIndex()).isZero();
      assertThat(check.consolidatedCorrectly()).isFalse();
      assertThat(check.actualTarget()).isEqualTo("Deep Work");
    }

    @Test
    void new_note_without_expectation_is_correct() {
      ExtractedNote note = new ExtractedNoteBuilder().content("Gardening plans").build();

      ConsolidationCheck check = groundTruth.checkConsolidation(note, EXISTING, CONSOLIDATIONS);

      assertThat(check.shouldHaveConsolidated()).isFalse();
      assertThat(check.consolidatedCorrectly()).isTrue();
      assertThat(check.expectationIndex()).isEqualTo(ConsolidationCheck.NO_EXPECTATION);
    }

    @Test
    void unexpected_merge_is_incorrect() {
      ExtractedNote note =
          new ExtractedNoteBuilder().content("Gardening plans").consolidatedWith("Nowhere").build();

      ConsolidationCheck check = groundTruth.checkConsolidation(note, EXISTING, CONSOLIDATIONS);

      assertThat(check.didConsolidate()).isTrue();
      assertThat(check.consolidatedCorrectly()).isFalse();
    }

    @Test
    void invalid_regex_falls_back_to_literal_match() {
      List<ExpectedConsolidation> expected =
          List.of(new ExpectedConsolidation("[unclosed", "Deep Work", List.of()));
      ExtractedNote note =
          new ExtractedNoteBuilder().content("Notes with an [UNCLOSED bracket").build();

      ConsolidationCheck check = groundTruth.checkConsolidation(note, EXISTING, expected);

      assertThat(check.shouldHaveConsolidated()).isTrue();
    }

    @Test
    void blank_pattern_never_matches() {
      List<ExpectedConsolidation> expected =
          List.of(new ExpectedConsolidation("", "Deep Work", List.of()));
      ExtractedNote note = new ExtractedNoteBuilder().content("anything").build();

      assertThat(
              groundTruth.checkConsolidation(note, EXISTING, expected).shouldHaveConsolidated())
          .isFalse();
    }
  }

  @Nested
  class Connections {

    private final ExtractedNote note =
        new ExtractedNoteBuilder()
            .connection("Deep Work", "related")
            .connection("Other Note", "extends")
            .build();

    @Test
    void counts_correct_and_spurious_and_skips_unknown_targets() {
      ExpectedNote expected =
          new ExpectedNote(
              List.of(),
              List.of(),
              null,
              List.of(),
              List.of(
                  new ExpectedConnection("deep work", List.of("related")),
                  new ExpectedConnection("Unknown Note", List.of())));

      ConnectionEvaluation evaluation =
          groundTruth.evaluateConnections(note, expected, List.of("Deep Work"));

      assertThat(evaluation).isEqualTo(new ConnectionEvaluation(1, 0, 1));
    }

    @Test
    void wrong_type_is_missed() {
      ExpectedNote expected =
          new ExpectedNote(
              List.of(),
              List.of(),
              null,
              List.of(),
              List.of(new ExpectedConnection("Deep Work", List.of("EXTENDS"))));

      ConnectionEvaluation evaluation =
          groundTruth.evaluateConnections(note, expected, List.of("Deep Work"));

      assertThat(evaluation).isEqualTo(new ConnectionEvaluation(0, 1, 2));
    }

    @Test
    void each_actual_connection_satisfies_one_expectation() {
      ExpectedNote expected =
          new ExpectedNote(
              List.of(),
              List.of(),
              null,
              List.of(),
              List.of(
                  new ExpectedConnection("Deep Work", List.of()),
                  new ExpectedConnection("Deep Work", List.of())));

      ConnectionEvaluation evaluation =
          groundTruth.evaluateConnections(note, expected, List.of("Deep Work"));

      assertThat(evaluation).isEqualTo(new ConnectionEvaluation(1, 1, 1));
    }
  }

  @Nested
  class TagReuse {

    @Test
    void case_and_hash_variants_restate_existing_tag() {
      TagReuseCheck check = groundTruth.shouldReuseTag("#Productivity", List.of("productivity"));

      assertThat(check.shouldReuse()).isTrue();
      assertThat(check.existingTag()).isEqualTo("productivity");
    }

    @Test
    void synonyms_restate_existing_tag() {
      assertThat(groundTruth.shouldReuseTag("ml", List.of("machine-learning")).existingTag())
          .isEqualTo("machine-learning");
      assertThat(groundTruth.shouldReuseTag("workout", List.of("exercise")).shouldReuse())
          .isTrue();
    }

    @Test
    void separators_are_ignored() {
      assertThat(groundTruth.shouldReuseTag("deep work", List.of("deep-work")).shouldReuse())
          .isTrue();
    }

    @Test
    void exact_match_is_preferred_over_earlier_synonym() {
      TagReuseCheck check = groundTruth.shouldReuseTag("habit", List.of("habits", "habit"));

      assertThat(check.existingTag()).isEqualTo("habit");
    }

    @Test
    void unrelated_tag_is_new() {
      assertThat(groundTruth.shouldReuseTag("gardening", List.of("habits")))
          .isEqualTo(TagReuseCheck.NEW_TAG);
    }
  }
}
