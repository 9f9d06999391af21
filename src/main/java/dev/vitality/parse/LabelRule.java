package dev.vitality.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * One entry of a {@link FieldGrammar}: a pattern and the capture group holding the value.
 *
 * @param pattern the pattern searched for anywhere in the text
 * @param group the capture group to return, 0 for the whole match
 */
public record LabelRule(Pattern pattern, int group) {

  public LabelRule {
    if (group < 0 || group > pattern.matcher("").groupCount()) {
      throw new IllegalArgumentException(
          "Group " + group + " does not exist in pattern " + pattern.pattern());
    }
  }

  /** Case-insensitive rule compiled from a regular expression. */
  public static LabelRule of(String regex, int group) {
    return new LabelRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), group);
  }

  /**
   * Finds the first match in {@code text}.
   *
   * @return the trimmed captured value, or null if the rule does not match or captures blank text
   */
  public @Nullable String find(String text) {
    Matcher matcher = pattern.matcher(text);
    if (!matcher.find()) {
      return null;
    }
    String value = matcher.group(group);
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
