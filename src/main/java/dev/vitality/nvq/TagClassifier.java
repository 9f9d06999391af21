package dev.vitality.nvq;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sorts tags into functional families by prefix.
 *
 * <p>Tags are compared lower-cased with any leading {@code #} removed. {@code task/} and {@code
 * decision/} are action tags, {@code skill/} skill tags, {@code insight/} and {@code evolution/}
 * evolution tags, {@code ui/} and {@code project/} project tags. Anything else is a topic tag.
 */
public final class TagClassifier {

  private static final Map<TagCategory, Pattern> PREFIXES =
      Map.of(
          TagCategory.ACTION, Pattern.compile("^(task|decision)/"),
          TagCategory.SKILL, Pattern.compile("^skill/"),
          TagCategory.EVOLUTION, Pattern.compile("^(insight|evolution)/"),
          TagCategory.PROJECT, Pattern.compile("^(ui|project)/"));

  private static final List<TagCategory> ORDER =
      List.of(TagCategory.ACTION, TagCategory.SKILL, TagCategory.EVOLUTION, TagCategory.PROJECT);

  private TagClassifier() {}

  public static ClassifiedTag classify(String tag) {
    String normalized = normalize(tag);
    for (TagCategory category : ORDER) {
      var matcher = PREFIXES.get(category).matcher(normalized);
      if (matcher.find()) {
        String rest = normalized.substring(matcher.end());
        int slash = rest.indexOf('/');
        String qualifier = slash >= 0 ? rest.substring(0, slash) : rest;
        return new ClassifiedTag(tag, category, qualifier.isEmpty() ? null : qualifier);
      }
    }
    return new ClassifiedTag(tag, TagCategory.TOPIC, null);
  }

  public static List<ClassifiedTag> classifyAll(List<String> tags) {
    return tags.stream().map(TagClassifier::classify).toList();
  }

  public static boolean isFunctional(String tag) {
    return classify(tag).functional();
  }

  static String normalize(String tag) {
    String trimmed = tag == null ? "" : tag.trim();
    if (trimmed.startsWith("#")) {
      trimmed = trimmed.substring(1);
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }
}
