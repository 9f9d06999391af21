package dev.vitality.note;

import java.util.function.Function;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Case- and whitespace-insensitive lookup of enum constants by display label. */
final class Labels {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private Labels() {}

  static <E extends Enum<E>> @Nullable E resolve(
      E[] values, @Nullable String label, Function<E, String> labelOf) {
    if (label == null || label.isBlank()) {
      return null;
    }
    String normalised = WHITESPACE.matcher(label.trim()).replaceAll(" ");
    for (E value : values) {
      if (labelOf.apply(value).equalsIgnoreCase(normalised)) {
        return value;
      }
    }
    return null;
  }
}
