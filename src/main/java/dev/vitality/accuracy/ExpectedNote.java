package dev.vitality.accuracy;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Hand-authored description of a note the extraction should produce.
 *
 * @param titlePatterns case-insensitive title substrings; a pattern may hold {@code |} alternatives
 * @param requiredPhrases phrases the content should contain
 * @param shouldConsolidateWith title of the existing note this one should merge into, if any
 * @param expectedTags tags the note should carry
 * @param expectedConnections connections the note should carry
 */
public record ExpectedNote(
    List<String> titlePatterns,
    List<String> requiredPhrases,
    @Nullable String shouldConsolidateWith,
    List<String> expectedTags,
    List<ExpectedConnection> expectedConnections) {

  public ExpectedNote {
    titlePatterns =
        titlePatterns == null
            ? List.of()
            : titlePatterns.stream().filter(Objects::nonNull).toList();
    requiredPhrases =
        requiredPhrases == null
            ? List.of()
            : requiredPhrases.stream().filter(Objects::nonNull).toList();
    expectedTags =
        expectedTags == null
            ? List.of()
            : expectedTags.stream().filter(Objects::nonNull).toList();
    expectedConnections =
        expectedConnections == null
            ? List.of()
            : expectedConnections.stream().filter(Objects::nonNull).toList();
  }
}
