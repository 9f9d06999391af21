package dev.vitality.accuracy;

import java.util.List;
import java.util.Objects;

/**
 * A merge the extraction should perform.
 *
 * @param newContentPattern case-insensitive regular expression identifying the new content
 * @param existingNoteTitle title of the note the content belongs to
 * @param mergedContentPhrases phrases the merged note should keep
 */
public record ExpectedConsolidation(
    String newContentPattern, String existingNoteTitle, List<String> mergedContentPhrases) {

  public ExpectedConsolidation {
    newContentPattern = newContentPattern == null ? "" : newContentPattern;
    existingNoteTitle = existingNoteTitle == null ? "" : existingNoteTitle;
    mergedContentPhrases =
        mergedContentPhrases == null
            ? List.of()
            : mergedContentPhrases.stream().filter(Objects::nonNull).toList();
  }
}
