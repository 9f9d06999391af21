package dev.vitality.nvq;

/**
 * A connection or content wikilink with its direction.
 *
 * @param originalType the declared connection type, {@code "reference"} for content wikilinks
 */
public record ClassifiedConnection(
    String targetTitle,
    String originalType,
    ConnectionDirection direction,
    boolean toMoc,
    boolean toProject) {}
