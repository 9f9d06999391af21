package dev.vitality.nvq;

/** Human-readable reason for the first unmet sub-check of a failing component. */
public final class FailureReasons {

  private FailureReasons() {}

  public static String reasonFor(NvqScore score, NvqComponent component) {
    NvqBreakdown b = score.breakdown();
    switch (component) {
      case WHY:
        if (!b.why().hasFirstPerson()) {
          return "Missing first-person statement";
        }
        if (!b.why().linksToPersonalGoal()) {
          return "No link to personal goal";
        }
        if (!b.why().actionable()) {
          return "Not actionable";
        }
        return "Unknown why issue";
      case METADATA:
        if (!b.metadata().hasStatus()) {
          return "Missing status field";
        }
        if (!b.metadata().hasType()) {
          return "Missing type field";
        }
        if (!b.metadata().hasStakeholder()) {
          return "Missing stakeholder field";
        }
        return "Incomplete metadata";
      case TAXONOMY:
        if (b.taxonomy().topicTags() > 0) {
          return "Contains topic tags instead of functional";
        }
        return "No functional tags";
      case CONNECTIVITY:
        if (!b.connectivity().hasUpwardLink()) {
          return "Missing upward link";
        }
        if (!b.connectivity().hasSidewaysLink()) {
          return "Missing sideways link";
        }
        return "Insufficient connections";
      case ORIGINALITY:
        if (b.originality().wikipediaFact()) {
          return "Pure fact without synthesis";
        }
        return "Low synthesis ratio";
      default:
        throw new IllegalArgumentException("Unknown component: " + component);
    }
  }

  /** {@code "<component>: <reason>"} */
  public static String issueFor(NvqScore score, NvqComponent component) {
    return component.key() + ": " + reasonFor(score, component);
  }
}
