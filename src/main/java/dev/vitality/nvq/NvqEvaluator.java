package dev.vitality.nvq;

import dev.vitality.note.ExtractedNote;
import dev.vitality.nvq.NvqBreakdown.ConnectivityScore;
import dev.vitality.nvq.NvqBreakdown.MetadataScore;
import dev.vitality.nvq.NvqBreakdown.OriginalityScore;
import dev.vitality.nvq.NvqBreakdown.TaxonomyScore;
import dev.vitality.nvq.NvqBreakdown.WhyScore;
import dev.vitality.parse.NoteFieldParser;
import org.springframework.stereotype.Component;

/**
 * Scores notes against the ten-point Note Vitality Quotient rubric.
 *
 * <p>Stateless: configuration is passed per call, so one bean serves every scenario and may be
 * called from parallel streams.
 */
@Component
public class NvqEvaluator {

  private final NoteFieldParser parser;

  public NvqEvaluator(NoteFieldParser parser) {
    this.parser = parser;
  }

  /**
   * Scores one note.
   *
   * @param note the note and its quality fields
   * @param config upward targets, goals and threshold
   * @return the score; {@code total} always equals the sum of the breakdown
   */
  public NvqScore evaluate(QualityNote note, NvqEvaluatorConfig config) {
    WhyScore why = ComponentScorers.scoreWhy(note, config.goals());
    MetadataScore metadata = ComponentScorers.scoreMetadata(note, parser);
    TaxonomyScore taxonomy = ComponentScorers.scoreTaxonomy(note);
    ConnectivityScore connectivity =
        ComponentScorers.scoreConnectivity(note, ConnectionClassifier.from(config));
    OriginalityScore originality = ComponentScorers.scoreOriginality(note);

    NvqBreakdown breakdown = new NvqBreakdown(why, metadata, taxonomy, connectivity, originality);
    return NvqScore.of(breakdown, config.passingThreshold());
  }

  /** Recovers quality fields from the note's content, then scores it. */
  public NvqScore evaluate(ExtractedNote note, NvqEvaluatorConfig config) {
    return evaluate(toQualityNote(note), config);
  }

  public QualityNote toQualityNote(ExtractedNote note) {
    return QualityNote.recover(note, parser);
  }
}
