package dev.vitality.note;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/** Kind of content a note carries. */
public enum NoteType {
  LOGIC("Logic"),
  TECHNICAL("Technical"),
  REFLECTION("Reflection");

  private final String label;

  NoteType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  @JsonCreator
  public static @Nullable NoteType fromLabel(@Nullable String label) {
    return Labels.resolve(values(), label, NoteType::label);
  }
}
