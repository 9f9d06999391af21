package dev.vitality.note;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/** Intended audience of a note. */
public enum Stakeholder {
  SELF("Self"),
  FUTURE_USERS("Future Users"),
  AI_AGENT("AI Agent");

  private final String label;

  Stakeholder(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  @JsonCreator
  public static @Nullable Stakeholder fromLabel(@Nullable String label) {
    return Labels.resolve(values(), label, Stakeholder::label);
  }
}
