package dev.vitality.accuracy;

import dev.vitality.note.ExtractedNote;
import dev.vitality.note.NoteConnection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares extracted notes with hand-authored expectations.
 *
 * <p>Malformed expectations never throw: an invalid consolidation pattern falls back to a literal
 * substring test, and an expected connection pointing at a note nobody knows about is skipped.
 */
@Component
public class GroundTruth {

  private static final Logger log = LoggerFactory.getLogger(GroundTruth.class);

  private final NoteMatcher matcher;
  private final TagReuseRules tagReuseRules;

  public GroundTruth(NoteMatcher matcher, TagReuseRules tagReuseRules) {
    this.matcher = matcher;
    this.tagReuseRules = tagReuseRules;
  }

  public MatchResult findMatchingExpectedNote(ExtractedNote note, List<ExpectedNote> expected) {
    return matcher.findMatch(note, expected);
  }

  /**
   * Checks the note's merge decision against the first expectation whose pattern is found in the
   * note's content.
   */
  public ConsolidationCheck checkConsolidation(
      ExtractedNote note,
      List<ExistingNote> existingNotes,
      List<ExpectedConsolidation> expectedConsolidations) {
    int index = ConsolidationCheck.NO_EXPECTATION;
    for (int i = 0; i < expectedConsolidations.size(); i++) {
      if (contentMatches(note.content(), expectedConsolidations.get(i).newContentPattern())) {
        index = i;
        break;
      }
    }

    boolean should = index >= 0;
    boolean did = note.isConsolidated();
    String expectedTarget = should ? expectedConsolidations.get(index).existingNoteTitle() : null;
    String actualTarget = did ? note.consolidatedWith() : null;

    boolean correct;
    if (should && did) {
      correct = actualTarget.equalsIgnoreCase(expectedTarget);
    } else {
      correct = !should && !did;
    }
    if (did && !targetExists(actualTarget, existingNotes)) {
      log.debug("Note '{}' merged into unknown note '{}'", note.title(), actualTarget);
    }
    return new ConsolidationCheck(should, did, correct, expectedTarget, actualTarget, index);
  }

  public TagReuseCheck shouldReuseTag(String tag, List<String> existingTags) {
    return tagReuseRules.check(tag, existingTags);
  }

  /**
   * Counts expected connections the note carries.
   *
   * <p>Each actual connection satisfies at most one expectation. Expected connections whose
   * pattern matches neither a known note title nor any actual target are skipped.
   *
   * @param allNoteTitles titles of every note the expectation could legitimately point at
   */
  public ConnectionEvaluation evaluateConnections(
      ExtractedNote note, ExpectedNote expected, List<String> allNoteTitles) {
    List<NoteConnection> actual = note.connections();
    boolean[] used = new boolean[actual.size()];
    int correct = 0;
    int missed = 0;

    for (ExpectedConnection expectation : expected.expectedConnections()) {
      String pattern = expectation.targetTitlePattern();
      boolean known =
          allNoteTitles.stream().anyMatch(title -> targetMatches(title, pattern))
              || actual.stream().anyMatch(c -> targetMatches(c.targetTitle(), pattern));
      if (!known) {
        log.debug("Skipping expected connection to unknown target '{}'", pattern);
        continue;
      }

      int hit = -1;
      for (int i = 0; i < actual.size(); i++) {
        NoteConnection connection = actual.get(i);
        if (!used[i]
            && targetMatches(connection.targetTitle(), pattern)
            && typeAccepted(connection.type(), expectation.types())) {
          hit = i;
          break;
        }
      }
      if (hit >= 0) {
        used[hit] = true;
        correct++;
      } else {
        missed++;
      }
    }
    return new ConnectionEvaluation(correct, missed, actual.size() - correct);
  }

  static boolean contentMatches(String content, String pattern) {
    if (pattern.isEmpty()) {
      return false;
    }
    try {
      return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
          .matcher(content)
          .find();
    } catch (PatternSyntaxException e) {
      log.debug("Invalid consolidation pattern '{}', using literal match", pattern);
      return content.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
    }
  }

  private static boolean targetMatches(String target, String pattern) {
    return PatternNoteMatcher.containsAlternative(target.toLowerCase(Locale.ROOT), pattern);
  }

  private static boolean typeAccepted(String type, List<String> accepted) {
    return accepted.isEmpty() || accepted.stream().anyMatch(type::equalsIgnoreCase);
  }

  private static boolean targetExists(@Nullable String title, List<ExistingNote> existingNotes) {
    return title != null && existingNotes.stream().anyMatch(n -> n.title().equalsIgnoreCase(title));
  }
}
