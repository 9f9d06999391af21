package dev.vitality.nvq;

import com.fasterxml.jackson.annotation.JsonValue;

/** The five components of the Note Vitality Quotient, in rubric order. */
public enum NvqComponent {
  WHY("why", 3),
  METADATA("metadata", 2),
  TAXONOMY("taxonomy", 2),
  CONNECTIVITY("connectivity", 2),
  ORIGINALITY("originality", 1);

  private final String key;
  private final int maxScore;

  NvqComponent(String key, int maxScore) {
    this.key = key;
    this.maxScore = maxScore;
  }

  @JsonValue
  public String key() {
    return key;
  }

  public int maxScore() {
    return maxScore;
  }
}
