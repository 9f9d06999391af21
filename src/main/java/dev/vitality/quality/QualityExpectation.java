package dev.vitality.quality;

import dev.vitality.note.ExtractedNote;
import dev.vitality.note.NoteStatus;
import dev.vitality.note.NoteType;
import dev.vitality.note.Stakeholder;
import dev.vitality.nvq.NvqScore;
import dev.vitality.nvq.QualityNote;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jspecify.annotations.Nullable;

/**
 * What a well-formed note for a given idea should look like.
 *
 * <p>A note matches when its title contains one of {@code titlePatterns} and its content contains
 * every phrase in {@code contentMustContain} (all case-insensitive). Each other field is optional
 * and only checked when set.
 *
 * @param purposePattern case-insensitive regular expression the purpose statement should match
 * @param expectedFunctionalTags tags the note should carry, compared ignoring case and a leading
 *     {@code #}
 * @param forbiddenTags topic tags the note should not carry
 * @param expectSynthesis when true, the note should show original insight
 */
public record QualityExpectation(
    List<String> titlePatterns,
    List<String> contentMustContain,
    @Nullable String purposePattern,
    @Nullable String expectedProject,
    @Nullable NoteStatus expectedStatus,
    @Nullable NoteType expectedType,
    @Nullable Stakeholder expectedStakeholder,
    List<String> expectedFunctionalTags,
    List<String> forbiddenTags,
    @Nullable Boolean expectSynthesis) {

  public QualityExpectation {
    titlePatterns =
        titlePatterns == null
            ? List.of()
            : titlePatterns.stream().filter(Objects::nonNull).toList();
    contentMustContain =
        contentMustContain == null
            ? List.of()
            : contentMustContain.stream().filter(Objects::nonNull).toList();
    expectedFunctionalTags =
        expectedFunctionalTags == null
            ? List.of()
            : expectedFunctionalTags.stream().filter(Objects::nonNull).toList();
    forbiddenTags =
        forbiddenTags == null
            ? List.of()
            : forbiddenTags.stream().filter(Objects::nonNull).toList();
  }

  public boolean matches(ExtractedNote note) {
    String title = note.title().toLowerCase(Locale.ROOT);
    String content = note.content().toLowerCase(Locale.ROOT);
    boolean titleMatch =
        titlePatterns.stream().anyMatch(p -> title.contains(p.toLowerCase(Locale.ROOT)));
    boolean contentMatch =
        contentMustContain.stream().allMatch(p -> content.contains(p.toLowerCase(Locale.ROOT)));
    return titleMatch && contentMatch;
  }

  /**
   * Lists every way the scored note departs from this expectation.
   *
   * @return issue lines, empty when the note conforms
   */
  public List<String> conformanceIssues(QualityNote note, NvqScore score) {
    List<String> issues = new ArrayList<>();

    if (purposePattern != null && !purposePattern.isBlank()) {
      String purpose = note.purposeStatement();
      if (purpose == null || !find(purposePattern, purpose)) {
        issues.add("Purpose statement does not match expected pattern");
      }
    }
    if (expectedProject != null && !expectedProject.isBlank()) {
      String project = score.breakdown().metadata().projectLink();
      if (project == null
          || !project.toLowerCase(Locale.ROOT).contains(expectedProject.toLowerCase(Locale.ROOT))) {
        issues.add(mismatch("project", expectedProject, project));
      }
    }
    if (expectedStatus != null && expectedStatus != note.status()) {
      issues.add(mismatch("status", expectedStatus.label(), labelOf(note.status())));
    }
    if (expectedType != null && expectedType != note.noteType()) {
      issues.add(mismatch("type", expectedType.label(), labelOf(note.noteType())));
    }
    if (expectedStakeholder != null && expectedStakeholder != note.stakeholder()) {
      issues.add(
          mismatch("stakeholder", expectedStakeholder.label(), labelOf(note.stakeholder())));
    }

    Set<String> tags = new HashSet<>();
    note.tags().forEach(tag -> tags.add(normalizeTag(tag)));
    for (String expected : expectedFunctionalTags) {
      if (!tags.contains(normalizeTag(expected))) {
        issues.add("Missing expected tag " + expected);
      }
    }
    for (String forbidden : forbiddenTags) {
      if (tags.contains(normalizeTag(forbidden))) {
        issues.add("Forbidden tag present: " + forbidden);
      }
    }

    if (Boolean.TRUE.equals(expectSynthesis)
        && !score.breakdown().originality().hasOriginalInsight()) {
      issues.add("Expected synthesis but note lacks original insight");
    }
    return issues;
  }

  private static String mismatch(String field, String expected, @Nullable String actual) {
    return "Expected "
        + field
        + " "
        + expected
        + " but found "
        + Objects.requireNonNullElse(actual, "none");
  }

  private static @Nullable String labelOf(@Nullable Object value) {
    if (value instanceof NoteStatus status) {
      return status.label();
    }
    if (value instanceof NoteType type) {
      return type.label();
    }
    if (value instanceof Stakeholder stakeholder) {
      return stakeholder.label();
    }
    return null;
  }

  private static boolean find(String regex, String text) {
    try {
      return Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(text).find();
    } catch (PatternSyntaxException e) {
      return text.toLowerCase(Locale.ROOT).contains(regex.toLowerCase(Locale.ROOT));
    }
  }

  private static String normalizeTag(String tag) {
    String trimmed = tag.trim();
    return (trimmed.startsWith("#") ? trimmed.substring(1) : trimmed).toLowerCase(Locale.ROOT);
  }
}
