package dev.vitality.note;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/** Maturity of a note. */
public enum NoteStatus {
  SEED("Seed"),
  SAPLING("Sapling"),
  EVERGREEN("Evergreen");

  private final String label;

  NoteStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Resolves a label case-insensitively.
   *
   * @param label the label as written in note content
   * @return the matching status, or null if the label is not part of the vocabulary
   */
  @JsonCreator
  public static @Nullable NoteStatus fromLabel(@Nullable String label) {
    return Labels.resolve(values(), label, NoteStatus::label);
  }
}
