package dev.vitality.accuracy;

import java.util.List;
import java.util.Objects;

/**
 * A connection the extracted note is expected to carry.
 *
 * @param targetTitlePattern case-insensitive substring of the target title; {@code |} separates
 *     alternatives
 * @param types acceptable connection types; empty accepts any type
 */
public record ExpectedConnection(String targetTitlePattern, List<String> types) {

  public ExpectedConnection {
    targetTitlePattern = targetTitlePattern == null ? "" : targetTitlePattern;
    types = types == null ? List.of() : types.stream().filter(Objects::nonNull).toList();
  }
}
