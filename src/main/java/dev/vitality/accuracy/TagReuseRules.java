package dev.vitality.accuracy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides whether a newly assigned tag should have reused an existing one.
 *
 * <p>A tag restates an existing tag when they are equal ignoring case and a leading {@code #},
 * when both belong to the same synonym group, or when they are equal after removing hyphens and
 * whitespace.
 */
public final class TagReuseRules {

  /** Canonical tag to its variants. */
  public static final Map<String, List<String>> DEFAULT_SYNONYMS = defaultSynonyms();

  private static final Pattern SEPARATORS = Pattern.compile("[-\\s]");

  private final Map<String, List<String>> synonymGroups;

  public TagReuseRules(Map<String, List<String>> synonymGroups) {
    Map<String, List<String>> normalized = new LinkedHashMap<>();
    synonymGroups.forEach(
        (canonical, variants) ->
            normalized.put(
                normalize(canonical), variants.stream().map(TagReuseRules::normalize).toList()));
    this.synonymGroups = Map.copyOf(normalized);
  }

  public static TagReuseRules defaults() {
    return new TagReuseRules(DEFAULT_SYNONYMS);
  }

  public Map<String, List<String>> synonymGroups() {
    return synonymGroups;
  }

  /**
   * Checks {@code tag} against every existing tag in order.
   *
   * @return the first existing tag it restates, or {@link TagReuseCheck#NEW_TAG}
   */
  public TagReuseCheck check(String tag, List<String> existingTags) {
    String candidate = normalize(tag);
    for (String existing : existingTags) {
      if (normalize(existing).equals(candidate)) {
        return new TagReuseCheck(true, existing);
      }
    }
    for (String existing : existingTags) {
      String current = normalize(existing);
      if (synonymous(candidate, current) || squash(candidate).equals(squash(current))) {
        return new TagReuseCheck(true, existing);
      }
    }
    return TagReuseCheck.NEW_TAG;
  }

  private boolean synonymous(String candidate, String existing) {
    for (Map.Entry<String, List<String>> group : synonymGroups.entrySet()) {
      boolean candidateIn =
          group.getKey().equals(candidate) || group.getValue().contains(candidate);
      boolean existingIn = group.getKey().equals(existing) || group.getValue().contains(existing);
      if (candidateIn && existingIn) {
        return true;
      }
    }
    return false;
  }

  static String normalize(String tag) {
    String trimmed = tag == null ? "" : tag.trim();
    if (trimmed.startsWith("#")) {
      trimmed = trimmed.substring(1);
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }

  private static String squash(String tag) {
    return SEPARATORS.matcher(tag).replaceAll("");
  }

  private static Map<String, List<String>> defaultSynonyms() {
    Map<String, List<String>> groups = new LinkedHashMap<>();
    groups.put("machine-learning", List.of("ml", "machine learning", "machinelearning"));
    groups.put(
        "artificial-intelligence",
        List.of("ai", "artificial intelligence", "artificialintelligence"));
    groups.put("productivity", List.of("productive", "being-productive", "efficiency"));
    groups.put("note-taking", List.of("notes", "note-management", "notetaking"));
    groups.put("software-development", List.of("programming", "coding", "development"));
    groups.put("health", List.of("wellness", "wellbeing", "well-being"));
    groups.put("fitness", List.of("exercise", "workout", "workouts", "physical-fitness"));
    groups.put("habits", List.of("habit", "routines", "daily-habits"));
    groups.put("learning", List.of("education", "study", "studying"));
    return Collections.unmodifiableMap(groups);
  }
}
