package dev.vitality.note;

/**
 * A typed link from an extracted note to another note.
 *
 * @param targetTitle title of the linked note
 * @param type relation type, e.g. {@code related}, {@code extends}, {@code example_of}
 * @param strength link strength, clamped to [0, 1]
 */
public record NoteConnection(String targetTitle, String type, double strength) {

  /** Relation type assumed when the pipeline supplies none. */
  public static final String DEFAULT_TYPE = "related";

  public NoteConnection {
    targetTitle = targetTitle == null ? "" : targetTitle;
    type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
    strength = Double.isNaN(strength) ? 0.0 : Math.max(0.0, Math.min(1.0, strength));
  }

  /** Convenience constructor with full strength. */
  public NoteConnection(String targetTitle, String type) {
    this(targetTitle, type, 1.0);
  }
}
