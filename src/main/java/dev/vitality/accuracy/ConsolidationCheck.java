package dev.vitality.accuracy;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of comparing one extracted note's merge decision with the expected consolidations.
 *
 * @param consolidatedCorrectly true when merged into the expected target, or when neither expected
 *     nor performed
 * @param expectationIndex index of the matching expectation, or {@link #NO_EXPECTATION}
 */
public record ConsolidationCheck(
    boolean shouldHaveConsolidated,
    boolean didConsolidate,
    boolean consolidatedCorrectly,
    @Nullable String expectedTarget,
    @Nullable String actualTarget,
    int expectationIndex) {

  public static final int NO_EXPECTATION = -1;
}
