package dev.vitality.nvq;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of scoring one note against the NVQ rubric.
 *
 * @param total sum of the component scores, 0 to 10
 * @param breakdown per-component detail
 * @param passing whether {@code total} reaches the configured threshold
 * @param failingComponents components that scored exactly 0, in rubric order
 */
public record NvqScore(
    int total, NvqBreakdown breakdown, boolean passing, List<NvqComponent> failingComponents) {

  public static final int MAX_TOTAL = 10;

  public NvqScore {
    if (total != breakdown.total()) {
      throw new IllegalArgumentException(
          "total " + total + " does not match component sum " + breakdown.total());
    }
    failingComponents = List.copyOf(failingComponents);
  }

  /** Derives total, pass flag and failing components from a breakdown. */
  public static NvqScore of(NvqBreakdown breakdown, int passingThreshold) {
    List<NvqComponent> failing = new ArrayList<>();
    for (NvqComponent component : NvqComponent.values()) {
      if (breakdown.scoreOf(component) == 0) {
        failing.add(component);
      }
    }
    int total = breakdown.total();
    return new NvqScore(total, breakdown, total >= passingThreshold, failing);
  }
}
