package dev.vitality.nvq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.vitality.fixture.ExtractedNoteBuilder;
import dev.vitality.fixture.SampleNotes;
import dev.vitality.note.ExtractedNote;
import dev.vitality.note.NoteStatus;
import dev.vitality.note.NoteType;
import dev.vitality.note.Stakeholder;
import dev.vitality.parse.NoteFieldParser;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NvqEvaluatorTest {

  private static final NvqEvaluatorConfig CONFIG = SampleNotes.CONFIG;

  private final NvqEvaluator evaluator = new NvqEvaluator(new NoteFieldParser());

  private static ExtractedNote perfectNote() {
    return SampleNotes.perfect();
  }

  private static ExtractedNote factNote() {
    return SampleNotes.fact();
  }

  @Test
  void perfect_note_scores_ten() {
    NvqScore score = evaluator.evaluate(perfectNote(), CONFIG);

    assertThat(score.total()).isEqualTo(NvqScore.MAX_TOTAL);
    assertThat(score.passing()).isTrue();
    assertThat(score.failingComponents()).isEmpty();
    assertThat(score.breakdown().metadata().fieldsPresent()).isEqualTo(4);
    assertThat(score.breakdown().metadata().projectLink()).isEqualTo("Writing UI");
  }

  @Test
  void fact_note_scores_zero_and_fails_every_component() {
    NvqScore score = evaluator.evaluate(factNote(), CONFIG);

    assertThat(score.total()).isZero();
    assertThat(score.passing()).isFalse();
    assertThat(score.failingComponents()).containsExactly(NvqComponent.values());
    assertThat(score.breakdown().originality().wikipediaFact()).isTrue();
  }

  @Test
  void failure_reasons_name_first_unmet_check() {
    NvqScore score = evaluator.evaluate(factNote(), CONFIG);

    assertThat(FailureReasons.issueFor(score, NvqComponent.WHY))
        .isEqualTo("why: Missing first-person statement");
    assertThat(FailureReasons.reasonFor(score, NvqComponent.METADATA))
        .isEqualTo("Missing status field");
    assertThat(FailureReasons.reasonFor(score, NvqComponent.TAXONOMY))
        .isEqualTo("No functional tags");
    assertThat(FailureReasons.reasonFor(score, NvqComponent.CONNECTIVITY))
        .isEqualTo("Missing upward link");
    assertThat(FailureReasons.reasonFor(score, NvqComponent.ORIGINALITY))
        .isEqualTo("Pure fact without synthesis");
  }

  @Test
  void threshold_decides_passing() {
    NvqScore lenient = evaluator.evaluate(factNote(), CONFIG.withPassingThreshold(0));

    assertThat(lenient.passing()).isTrue();
  }

  @Test
  void negative_threshold_is_rejected() {
    assertThatThrownBy(() -> NvqEvaluatorConfig.defaults().withPassingThreshold(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void explicit_quality_fields_take_precedence_over_content() {
    QualityNote note =
        new QualityNote(
            factNote(),
            "I need this so that I can teach biology",
            "Vitality",
            NoteStatus.SEED,
            NoteType.LOGIC,
            Stakeholder.SELF);

    NvqScore score = evaluator.evaluate(note, CONFIG);

    assertThat(score.breakdown().metadata().score()).isEqualTo(2);
    assertThat(score.breakdown().why().hasFirstPerson()).isTrue();
    assertThat(score.breakdown().why().actionable()).isTrue();
    assertThat(score.breakdown().why().rawStatement())
        .isEqualTo("I need this so that I can teach biology");
  }

  @Nested
  class Metadata {

    @Test
    void two_fields_score_one() {
      QualityNote note =
          new QualityNote(factNote(), null, null, NoteStatus.SEED, NoteType.LOGIC, null);

      assertThat(evaluator.evaluate(note, CONFIG).breakdown().metadata().score()).isEqualTo(1);
    }

    @Test
    void project_mentioned_in_prose_counts() {
      ExtractedNote note =
          new ExtractedNoteBuilder()
              .content("Collected for the Writing UI project.\nStatus: Seed\nType: Logic")
              .build();

      NvqBreakdown.MetadataScore metadata =
          evaluator.evaluate(QualityNote.bare(note), CONFIG).breakdown().metadata();

      assertThat(metadata.hasProject()).isTrue();
      assertThat(metadata.projectLink()).isEqualTo("Writing UI");
      assertThat(metadata.hasStatus()).isFalse();
      assertThat(metadata.score()).isZero();
    }
  }

  @Nested
  class Taxonomy {

    @Test
    void mixed_tags_score_one() {
      ExtractedNote note = new ExtractedNoteBuilder().tags("#task/plan", "#productivity").build();

      NvqBreakdown.TaxonomyScore taxonomy =
          evaluator.evaluate(note, CONFIG).breakdown().taxonomy();

      assertThat(taxonomy.score()).isEqualTo(1);
      assertThat(taxonomy.functionalTags()).isEqualTo(1);
      assertThat(taxonomy.topicTags()).isEqualTo(1);
      assertThat(taxonomy.hasActionTag()).isTrue();
    }

    @Test
    void too_many_tags_are_flagged_without_penalty() {
      ExtractedNote note =
          new ExtractedNoteBuilder()
              .tags("#task/a", "#task/b", "#skill/c", "#insight/d", "#ui/e", "#project/f")
              .build();

      NvqBreakdown.TaxonomyScore taxonomy =
          evaluator.evaluate(note, CONFIG).breakdown().taxonomy();

      assertThat(taxonomy.exceedsLimit()).isTrue();
      assertThat(taxonomy.score()).isEqualTo(2);
    }

    @Test
    void topic_only_reason_mentions_topic_tags() {
      ExtractedNote note = new ExtractedNoteBuilder().tags("#productivity").build();

      NvqScore score = evaluator.evaluate(note, CONFIG);

      assertThat(FailureReasons.reasonFor(score, NvqComponent.TAXONOMY))
          .isEqualTo("Contains topic tags instead of functional");
    }
  }

  @Nested
  class Connectivity {

    @Test
    void sideways_only_scores_one() {
      ExtractedNote note = new ExtractedNoteBuilder().connection("Deep Work", "related").build();

      NvqBreakdown.ConnectivityScore connectivity =
          evaluator.evaluate(note, CONFIG).breakdown().connectivity();

      assertThat(connectivity.score()).isEqualTo(1);
      assertThat(connectivity.hasSidewaysLink()).isTrue();
      assertThat(connectivity.meetsMinimum()).isFalse();
    }

    @Test
    void content_wikilink_to_moc_supplies_upward_link() {
      ExtractedNote note =
          new ExtractedNoteBuilder()
              .content("Part of [[Knowledge Management]]")
              .connection("Deep Work", "related")
              .build();

      NvqBreakdown.ConnectivityScore connectivity =
          evaluator.evaluate(note, CONFIG).breakdown().connectivity();

      assertThat(connectivity.score()).isEqualTo(2);
      assertThat(connectivity.totalConnections()).isEqualTo(1);
    }

    @Test
    void unconfigured_moc_folder_and_nested_project_count_as_upward() {
      ExtractedNote note =
          new ExtractedNoteBuilder()
              .connection("MOCs/Health", "related")
              .connection("Areas/Project/Garden", "related")
              .connection("Deep Work", "related")
              .build();

      NvqBreakdown.ConnectivityScore connectivity =
          evaluator.evaluate(note, CONFIG).breakdown().connectivity();

      assertThat(connectivity.score()).isEqualTo(2);
      assertThat(connectivity.hasUpwardLink()).isTrue();
    }

    @Test
    void downward_links_do_not_count() {
      ExtractedNote note =
          new ExtractedNoteBuilder().connection("Sprint Board", "example_of").build();

      assertThat(evaluator.evaluate(note, CONFIG).breakdown().connectivity().score()).isZero();
    }
  }

  @Nested
  class Originality {

    @Test
    void quoted_text_lowers_synthesis_ratio() {
      String quote = "\"" + "a".repeat(40) + "\"";

      double ratio = ComponentScorers.synthesisRatio(quote + " mine");

      assertThat(ratio).isEqualTo(5.0 / 47.0);
    }

    @Test
    void empty_text_has_zero_ratio() {
      assertThat(ComponentScorers.synthesisRatio("")).isZero();
    }

    @Test
    void overlapping_quotations_are_counted_once() {
      String text = "> \"" + "b".repeat(30) + "\"";

      assertThat(ComponentScorers.synthesisRatio(text)).isZero();
    }

    @Test
    void mostly_quoted_note_reports_low_synthesis() {
      ExtractedNote note =
          new ExtractedNoteBuilder()
              .title("Q")
              .content("```\n" + "code line\n".repeat(10) + "```")
              .build();

      NvqScore score = evaluator.evaluate(note, CONFIG);

      assertThat(score.breakdown().originality().score()).isZero();
      assertThat(FailureReasons.reasonFor(score, NvqComponent.ORIGINALITY))
          .isEqualTo("Low synthesis ratio");
    }
  }
}
