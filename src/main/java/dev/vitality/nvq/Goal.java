package dev.vitality.nvq;

import org.jspecify.annotations.Nullable;

/**
 * A personal goal a note's purpose can link to.
 *
 * @param title goal title, matched case-insensitively against the note text
 * @param whyRoot the underlying motivation; ignored when null or blank
 */
public record Goal(String title, @Nullable String whyRoot) {

  public Goal {
    title = title == null ? "" : title;
  }
}
