package dev.vitality.parse;

import dev.vitality.note.NoteStatus;
import dev.vitality.note.NoteType;
import dev.vitality.note.Stakeholder;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Recovers purpose statements, project links and metadata labels from note content using a
 * {@link FieldGrammar}.
 *
 * <p>Stateless and thread-safe; the grammar is immutable.
 */
@Component
public class NoteFieldParser {

  private static final Pattern WIKILINK = Pattern.compile("\\[\\[([^\\]]+)\\]\\]");

  private final FieldGrammar grammar;

  public NoteFieldParser() {
    this(FieldGrammar.V1);
  }

  public NoteFieldParser(FieldGrammar grammar) {
    this.grammar = grammar;
  }

  public FieldGrammar grammar() {
    return grammar;
  }

  /**
   * Recovers every quality field from the given content.
   *
   * @param content note body; null is treated as empty
   * @return the recovered fields, each null when absent
   */
  public RecoveredFields recover(@Nullable String content) {
    String text = content == null ? "" : content;
    return new RecoveredFields(
        grammar.version(),
        purposeStatement(text),
        projectLink(text),
        status(text),
        noteType(text),
        stakeholder(text));
  }

  public @Nullable String purposeStatement(String content) {
    return firstMatch(grammar.purpose(), content);
  }

  public @Nullable String projectLink(String content) {
    return firstMatch(grammar.project(), content);
  }

  public @Nullable NoteStatus status(String content) {
    return NoteStatus.fromLabel(firstMatch(grammar.status(), content));
  }

  public @Nullable NoteType noteType(String content) {
    return NoteType.fromLabel(firstMatch(grammar.noteType(), content));
  }

  public @Nullable Stakeholder stakeholder(String content) {
    return Stakeholder.fromLabel(firstMatch(grammar.stakeholder(), content));
  }

  /**
   * Finds a project mentioned anywhere in the text, including prose such as "for the Writing UI
   * project".
   */
  public @Nullable String projectReference(String text) {
    return firstMatch(grammar.projectReference(), text);
  }

  /**
   * Extracts the targets of all {@code [[wikilinks]]} in order of appearance.
   *
   * @param text the text to scan
   * @return link targets, trimmed; empty if none
   */
  public static List<String> wikilinks(String text) {
    List<String> links = new ArrayList<>();
    Matcher matcher = WIKILINK.matcher(text);
    while (matcher.find()) {
      String target = matcher.group(1).trim();
      if (!target.isEmpty()) {
        links.add(target);
      }
    }
    return links;
  }

  private static @Nullable String firstMatch(List<LabelRule> rules, String text) {
    for (LabelRule rule : rules) {
      String value = rule.find(text);
      if (value != null) {
        return value;
      }
    }
    return null;
  }
}
