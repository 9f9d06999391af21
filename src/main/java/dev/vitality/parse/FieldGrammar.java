package dev.vitality.parse;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered label patterns used to recover quality fields from free-form note content.
 *
 * <p>Within each list the first matching rule wins, so more specific forms come first (a
 * {@code [[Project/...]]} wikilink before a bare {@code Project:} label). The grammar carries a
 * version so recovered fields can be traced back to the rules that produced them.
 *
 * @param version grammar revision
 * @param purpose rules for the purpose statement; these capture the whole statement
 * @param project rules for the project link; these capture the project name
 * @param status rules for the maturity status label
 * @param noteType rules for the note type label
 * @param stakeholder rules for the stakeholder label
 * @param projectReference looser rules used when scoring, to find a project mentioned in prose
 */
public record FieldGrammar(
    int version,
    List<LabelRule> purpose,
    List<LabelRule> project,
    List<LabelRule> status,
    List<LabelRule> noteType,
    List<LabelRule> stakeholder,
    List<LabelRule> projectReference) {

  public FieldGrammar {
    purpose = List.copyOf(purpose);
    project = List.copyOf(project);
    status = List.copyOf(status);
    noteType = List.copyOf(noteType);
    stakeholder = List.copyOf(stakeholder);
    projectReference = List.copyOf(projectReference);
  }

  /** The grammar used by extraction prompts since the first NVQ-aware pipeline release. */
  public static final FieldGrammar V1 =
      new FieldGrammar(
          1,
          List.of(
              LabelRule.of("I am keeping this because[^.\\n]*\\.?", 0),
              LabelRule.of("I['’]m keeping this because[^.\\n]*\\.?", 0),
              LabelRule.of("Purpose:\\s*([^\\n]+)", 0),
              LabelRule.of("Why:\\s*([^\\n]+)", 0)),
          List.of(
              LabelRule.of("\\[\\[Project/([^\\]]+)\\]\\]", 1),
              LabelRule.of("Project:\\s*\\[\\[([^\\]]+)\\]\\]", 1),
              LabelRule.of("Project:\\s*([^\\n]+)", 1)),
          List.of(LabelRule.of("Status:\\s*(Seed|Sapling|Evergreen)\\b", 1)),
          List.of(LabelRule.of("Type:\\s*(Logic|Technical|Reflection)\\b", 1)),
          List.of(LabelRule.of("Stakeholder:\\s*(Self|Future Users|AI Agent)\\b", 1)),
          List.of(
              LabelRule.of("\\[\\[Project[/:]([^\\]]+)\\]\\]", 1),
              LabelRule.of("project:\\s*([^\\n,]+)", 1),
              new LabelRule(
                  Pattern.compile("(?i:for (?:the |my )?)([A-Z][a-zA-Z ]+?) (?i:project)\\b"), 1)));
}
