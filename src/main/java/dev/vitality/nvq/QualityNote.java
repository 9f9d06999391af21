package dev.vitality.nvq;

import dev.vitality.note.ExtractedNote;
import dev.vitality.note.NoteConnection;
import dev.vitality.note.NoteStatus;
import dev.vitality.note.NoteType;
import dev.vitality.note.Stakeholder;
import dev.vitality.parse.NoteFieldParser;
import dev.vitality.parse.RecoveredFields;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An extracted note together with the quality fields the NVQ rubric looks at.
 *
 * <p>Every quality field is optional; a missing one simply fails the sub-check that needs it.
 */
public record QualityNote(
    ExtractedNote note,
    @Nullable String purposeStatement,
    @Nullable String project,
    @Nullable NoteStatus status,
    @Nullable NoteType noteType,
    @Nullable Stakeholder stakeholder) {

  public QualityNote {
    if (note == null) {
      throw new IllegalArgumentException("note must not be null");
    }
  }

  /** A note with no quality fields at all. */
  public static QualityNote bare(ExtractedNote note) {
    return new QualityNote(note, null, null, null, null, null);
  }

  /** Builds a quality note from fields recovered out of the note's own content. */
  public static QualityNote from(ExtractedNote note, RecoveredFields fields) {
    return new QualityNote(
        note,
        fields.purposeStatement(),
        fields.project(),
        fields.status(),
        fields.noteType(),
        fields.stakeholder());
  }

  public static QualityNote recover(ExtractedNote note, NoteFieldParser parser) {
    return from(note, parser.recover(note.content()));
  }

  public String title() {
    return note.title();
  }

  public String content() {
    return note.content();
  }

  public List<String> tags() {
    return note.tags();
  }

  public List<NoteConnection> connections() {
    return note.connections();
  }
}
