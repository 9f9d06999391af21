package dev.vitality.accuracy;

/**
 * Tag vocabulary discipline.
 *
 * @param reusedExisting tags that are exactly an existing tag
 * @param shouldHaveReused new tags that restate an existing tag in a different form
 * @param reuseRate {@code reused / (reused + shouldHaveReused)}, 1 when both are 0
 */
public record TagReuseMetrics(
    int reusedExisting,
    int correctlyCreatedNew,
    int shouldHaveReused,
    double reuseRate,
    int totalTagsAssigned) {

  public static TagReuseMetrics fromCounts(
      int reused, int createdNew, int shouldHaveReused, int totalAssigned) {
    return new TagReuseMetrics(
        reused,
        createdNew,
        shouldHaveReused,
        Ratios.ratio(reused, reused + shouldHaveReused, 1.0),
        totalAssigned);
  }
}
