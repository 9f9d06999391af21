package dev.vitality.accuracy;

import org.jspecify.annotations.Nullable;

/**
 * Whether a tag restates an existing one.
 *
 * @param existingTag the existing tag it restates, null when the tag is genuinely new
 */
public record TagReuseCheck(boolean shouldReuse, @Nullable String existingTag) {

  public static final TagReuseCheck NEW_TAG = new TagReuseCheck(false, null);
}
