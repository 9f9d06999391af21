package dev.vitality.accuracy;

import java.util.List;
import java.util.Objects;

/** A note already present in the knowledge base before extraction runs. */
public record ExistingNote(String id, String title, String content, List<String> tags) {

  public ExistingNote {
    id = id == null ? "" : id;
    title = title == null ? "" : title;
    content = content == null ? "" : content;
    tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList();
  }
}
