package dev.vitality.parse;

import dev.vitality.note.NoteStatus;
import dev.vitality.note.NoteType;
import dev.vitality.note.Stakeholder;
import org.jspecify.annotations.Nullable;

/**
 * Quality fields recovered from note content. Every field is null when its label is absent.
 *
 * @param grammarVersion version of the {@link FieldGrammar} that produced these values
 */
public record RecoveredFields(
    int grammarVersion,
    @Nullable String purposeStatement,
    @Nullable String project,
    @Nullable NoteStatus status,
    @Nullable NoteType noteType,
    @Nullable Stakeholder stakeholder) {}
