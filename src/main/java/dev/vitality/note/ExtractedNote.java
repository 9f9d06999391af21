package dev.vitality.note;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A single note produced by the upstream extraction pipeline.
 *
 * <p>Immutable once constructed. Null collections are normalised to empty lists, null tags are
 * dropped and duplicate tags collapse to their first occurrence so the tag list behaves as an
 * ordered set.
 *
 * @param title the note title
 * @param content the note body, possibly carrying labelled metadata lines
 * @param tags the tags assigned by the extraction pipeline
 * @param connections outgoing links to other notes
 * @param consolidatedWith title of the existing note this one was merged into, or null when the
 *     pipeline created a new note
 * @param mergedContent the merged body when the note was consolidated
 */
public record ExtractedNote(
    String title,
    String content,
    List<String> tags,
    List<NoteConnection> connections,
    @Nullable String consolidatedWith,
    @Nullable String mergedContent) {

  public ExtractedNote {
    title = title == null ? "" : title;
    content = content == null ? "" : content;
    tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).distinct().toList();
    connections =
        connections == null
            ? List.of()
            : connections.stream().filter(Objects::nonNull).toList();
  }

  /** Convenience constructor for a freshly created (not consolidated) note. */
  public ExtractedNote(
      String title, String content, List<String> tags, List<NoteConnection> connections) {
    this(title, content, tags, connections, null, null);
  }

  /**
   * Whether the extraction pipeline merged this note into an existing one.
   *
   * @return true when {@code consolidatedWith} names a target
   */
  @JsonIgnore
  public boolean isConsolidated() {
    return consolidatedWith != null && !consolidatedWith.isBlank();
  }
}
