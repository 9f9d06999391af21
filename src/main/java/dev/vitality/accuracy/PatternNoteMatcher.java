package dev.vitality.accuracy;

import dev.vitality.note.ExtractedNote;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Scores candidates by title, content and tag overlap.
 *
 * <p>A title pattern hit is worth 0.4, the share of required phrases present up to 0.4 and the
 * share of expected tags present up to 0.2. All comparisons are case-insensitive. The highest
 * score wins; on a tie the earlier candidate is kept.
 */
@Component
public class PatternNoteMatcher implements NoteMatcher {

  static final double TITLE_WEIGHT = 0.4;
  static final double PHRASE_WEIGHT = 0.4;
  static final double TAG_WEIGHT = 0.2;

  @Override
  public MatchResult findMatch(ExtractedNote note, List<ExpectedNote> candidates) {
    ExpectedNote best = null;
    double bestScore = 0.0;
    for (ExpectedNote candidate : candidates) {
      double score = score(note, candidate);
      if (score > bestScore) {
        bestScore = score;
        best = candidate;
      }
    }
    return best == null ? MatchResult.NONE : new MatchResult(best, bestScore);
  }

  double score(ExtractedNote note, ExpectedNote candidate) {
    double score = 0.0;
    if (titleMatches(note.title(), candidate.titlePatterns())) {
      score += TITLE_WEIGHT;
    }

    String content = note.content().toLowerCase(Locale.ROOT);
    long phrasesFound =
        candidate.requiredPhrases().stream()
            .filter(phrase -> content.contains(phrase.toLowerCase(Locale.ROOT)))
            .count();
    score += PHRASE_WEIGHT * phrasesFound / Math.max(candidate.requiredPhrases().size(), 1);

    Set<String> actualTags = new HashSet<>();
    note.tags().forEach(tag -> actualTags.add(tag.toLowerCase(Locale.ROOT)));
    long tagsFound =
        candidate.expectedTags().stream()
            .map(tag -> tag.toLowerCase(Locale.ROOT))
            .distinct()
            .filter(actualTags::contains)
            .count();
    score += TAG_WEIGHT * tagsFound / Math.max(candidate.expectedTags().size(), 1);
    return score;
  }

  /** True when the title contains any pattern, or any {@code |} alternative of a pattern. */
  public static boolean titleMatches(String title, List<String> patterns) {
    String lower = title.toLowerCase(Locale.ROOT);
    return patterns.stream().anyMatch(pattern -> containsAlternative(lower, pattern));
  }

  static boolean containsAlternative(String lowerText, String pattern) {
    for (String alternative : pattern.toLowerCase(Locale.ROOT).split("\\|")) {
      String trimmed = alternative.trim();
      if (!trimmed.isEmpty() && lowerText.contains(trimmed)) {
        return true;
      }
    }
    return false;
  }
}
