package dev.vitality.accuracy;

import org.jspecify.annotations.Nullable;

/**
 * Best expected note for an extracted note.
 *
 * @param match the highest-scoring candidate, or null when nothing scored above zero
 * @param confidence score of {@code match}, in [0, 1]
 */
public record MatchResult(@Nullable ExpectedNote match, double confidence) {

  /** Confidence a match must exceed before its connections are evaluated. */
  public static final double TRUST_THRESHOLD = 0.5;

  public static final MatchResult NONE = new MatchResult(null, 0.0);

  public boolean trusted() {
    return match != null && confidence > TRUST_THRESHOLD;
  }
}
