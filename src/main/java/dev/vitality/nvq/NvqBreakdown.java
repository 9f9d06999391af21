package dev.vitality.nvq;

import dev.vitality.note.NoteStatus;
import dev.vitality.note.NoteType;
import dev.vitality.note.Stakeholder;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Per-component detail of an NVQ evaluation. */
public record NvqBreakdown(
    WhyScore why,
    MetadataScore metadata,
    TaxonomyScore taxonomy,
    ConnectivityScore connectivity,
    OriginalityScore originality) {

  /** Sum of the five component scores. */
  public int total() {
    return why.score() + metadata.score() + taxonomy.score() + connectivity.score()
        + originality.score();
  }

  public int scoreOf(NvqComponent component) {
    return switch (component) {
      case WHY -> why.score();
      case METADATA -> metadata.score();
      case TAXONOMY -> taxonomy.score();
      case CONNECTIVITY -> connectivity.score();
      case ORIGINALITY -> originality.score();
    };
  }

  /** Purpose statement quality, 0 to 3. */
  public record WhyScore(
      int score,
      boolean hasFirstPerson,
      boolean linksToPersonalGoal,
      boolean actionable,
      @Nullable String rawStatement) {

    public WhyScore {
      checkRange(score, NvqComponent.WHY);
    }
  }

  /**
   * Metadata completeness, 0 to 2.
   *
   * @param fieldsPresent how many of project, status, type and stakeholder are set
   */
  public record MetadataScore(
      int score,
      boolean hasProject,
      @Nullable String projectLink,
      boolean hasStatus,
      @Nullable NoteStatus status,
      boolean hasType,
      @Nullable NoteType type,
      boolean hasStakeholder,
      @Nullable Stakeholder stakeholder,
      int fieldsPresent) {

    public MetadataScore {
      checkRange(score, NvqComponent.METADATA);
    }
  }

  /** Functional versus topic tagging, 0 to 2. */
  public record TaxonomyScore(
      int score,
      int totalTags,
      int functionalTags,
      int topicTags,
      List<ClassifiedTag> tagBreakdown,
      boolean hasActionTag,
      boolean hasSkillTag,
      boolean hasEvolutionTag,
      boolean hasProjectTag,
      boolean exceedsLimit) {

    public TaxonomyScore {
      checkRange(score, NvqComponent.TAXONOMY);
      tagBreakdown = List.copyOf(tagBreakdown);
    }
  }

  /** Upward and sideways linking, 0 to 2. */
  public record ConnectivityScore(
      int score,
      boolean hasUpwardLink,
      List<ClassifiedConnection> upwardLinks,
      boolean hasSidewaysLink,
      List<ClassifiedConnection> sidewaysLinks,
      int totalConnections,
      boolean meetsMinimum) {

    public ConnectivityScore {
      checkRange(score, NvqComponent.CONNECTIVITY);
      upwardLinks = List.copyOf(upwardLinks);
      sidewaysLinks = List.copyOf(sidewaysLinks);
    }
  }

  /** Synthesis over restated fact, 0 or 1. */
  public record OriginalityScore(
      int score,
      double synthesisRatio,
      boolean hasOriginalInsight,
      boolean wikipediaFact,
      String reasoning) {

    public OriginalityScore {
      checkRange(score, NvqComponent.ORIGINALITY);
    }
  }

  private static void checkRange(int score, NvqComponent component) {
    if (score < 0 || score > component.maxScore()) {
      throw new IllegalArgumentException(
          component.key() + " score must be in [0, " + component.maxScore() + "], got: " + score);
    }
  }
}
