package dev.vitality.nvq;

import com.fasterxml.jackson.annotation.JsonValue;

/** Functional tag families, plus {@link #TOPIC} for everything else. */
public enum TagCategory {
  ACTION("action"),
  SKILL("skill"),
  EVOLUTION("evolution"),
  PROJECT("project"),
  TOPIC("topic");

  private final String key;

  TagCategory(String key) {
    this.key = key;
  }

  @JsonValue
  public String key() {
    return key;
  }

  public boolean isFunctional() {
    return this != TOPIC;
  }
}
