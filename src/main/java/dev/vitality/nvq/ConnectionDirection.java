package dev.vitality.nvq;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where a link points within the knowledge hierarchy. */
public enum ConnectionDirection {
  /** To a Map of Content or a project. */
  UPWARD("upward"),
  /** To a peer concept. */
  SIDEWAYS("sideways"),
  /** To a concrete example. */
  DOWNWARD("downward");

  private final String key;

  ConnectionDirection(String key) {
    this.key = key;
  }

  @JsonValue
  public String key() {
    return key;
  }
}
