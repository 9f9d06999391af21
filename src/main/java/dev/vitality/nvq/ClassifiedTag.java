package dev.vitality.nvq;

import org.jspecify.annotations.Nullable;

/**
 * A tag with its category.
 *
 * @param raw the tag as written on the note
 * @param category functional family, or {@link TagCategory#TOPIC}
 * @param qualifier the part after the family prefix, {@code "refactor"} for {@code
 *     #task/refactor}; null for topic tags or a bare prefix
 */
public record ClassifiedTag(String raw, TagCategory category, @Nullable String qualifier) {

  public boolean functional() {
    return category.isFunctional();
  }
}
