package dev.vitality.nvq;

import dev.vitality.nvq.NvqBreakdown.ConnectivityScore;
import dev.vitality.nvq.NvqBreakdown.MetadataScore;
import dev.vitality.nvq.NvqBreakdown.OriginalityScore;
import dev.vitality.nvq.NvqBreakdown.TaxonomyScore;
import dev.vitality.nvq.NvqBreakdown.WhyScore;
import dev.vitality.parse.NoteFieldParser;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Scoring rules for the five NVQ components.
 *
 * <p>Every scorer is a pure function of the note and its inputs. Missing fields fail their
 * sub-check and never throw.
 */
public final class ComponentScorers {

  /** Tags beyond this count are flagged; the flag does not lower the score. */
  public static final int TAG_LIMIT = 5;

  /** Share of unquoted text above which a note counts as synthesis. */
  public static final double SYNTHESIS_THRESHOLD = 0.7;

  static final Pattern FIRST_PERSON =
      Pattern.compile(
          "I am keeping this because|I['’]m keeping this|I need this|This helps me"
              + "|I want to remember|^\\s*(Purpose|Why):",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  static final Pattern ACTIONABLE =
      Pattern.compile(
          "so that|because I can|in order to|will help|enables|allows|supports|helps me"
              + "|(crucial|vital|important|essential|necessary) for",
          Pattern.CASE_INSENSITIVE);

  static final List<Pattern> ORIGINAL_INSIGHT =
      caseInsensitive(
          "I (think|believe|realized|discovered|noticed|found|learned)",
          "my (interpretation|understanding|take|view|insight|conclusion)",
          "this (suggests|implies|means|tells me|indicates|reveals)",
          "the key (insight|takeaway|lesson|point) is",
          "for (my|our) (use case|project|context|situation)",
          "(decision|lesson learned|takeaway|conclusion):",
          "I (decided|chose|concluded|determined)",
          "what this means for",
          "in my experience",
          "I've (noticed|observed|seen)");

  static final List<Pattern> WIKIPEDIA_FACT =
      caseInsensitive(
          "according to (wikipedia|the documentation|the official)",
          "is defined as",
          "was (invented|created|founded|developed) in \\d{4}",
          "\\bis a\\b.*\\bthat\\b",
          "^(The|A|An) [A-Z][a-z]+ is",
          "officially (released|announced|launched)");

  static final List<Pattern> QUOTATIONS =
      List.of(
          Pattern.compile("\"[^\"]{20,}\""),
          Pattern.compile("(?m)^>[^\\n]{20,}"),
          Pattern.compile("```[\\s\\S]*?```"));

  private ComponentScorers() {}

  /**
   * Why (0-3): one point each for first-person phrasing, a link to a personal goal, and
   * actionable language.
   */
  public static WhyScore scoreWhy(QualityNote note, List<Goal> goals) {
    String purpose = note.purposeStatement() == null ? "" : note.purposeStatement();
    String text = note.title() + " " + note.content() + " " + purpose;

    boolean firstPerson = FIRST_PERSON.matcher(purpose).find() || FIRST_PERSON.matcher(text).find();
    boolean goalLink = linksToGoal(text, goals);
    boolean actionable = ACTIONABLE.matcher(purpose).find() || ACTIONABLE.matcher(text).find();

    int score = (firstPerson ? 1 : 0) + (goalLink ? 1 : 0) + (actionable ? 1 : 0);
    return new WhyScore(
        score, firstPerson, goalLink, actionable, purpose.isEmpty() ? null : purpose);
  }

  /**
   * Metadata (0-2): 3 or 4 of project, status, type and stakeholder give 2, exactly 2 give 1.
   * A project mentioned in the content counts when no explicit project is set.
   */
  public static MetadataScore scoreMetadata(QualityNote note, NoteFieldParser parser) {
    String projectLink =
        isBlank(note.project()) ? parser.projectReference(note.content()) : note.project();
    boolean hasProject = !isBlank(projectLink);
    boolean hasStatus = note.status() != null;
    boolean hasType = note.noteType() != null;
    boolean hasStakeholder = note.stakeholder() != null;

    int fieldsPresent =
        (hasProject ? 1 : 0) + (hasStatus ? 1 : 0) + (hasType ? 1 : 0) + (hasStakeholder ? 1 : 0);
    int score = fieldsPresent >= 3 ? 2 : fieldsPresent == 2 ? 1 : 0;

    return new MetadataScore(
        score,
        hasProject,
        projectLink,
        hasStatus,
        note.status(),
        hasType,
        note.noteType(),
        hasStakeholder,
        note.stakeholder(),
        fieldsPresent);
  }

  /** Taxonomy (0-2): all functional tags give 2, a mix gives 1, topic-only or no tags give 0. */
  public static TaxonomyScore scoreTaxonomy(QualityNote note) {
    List<ClassifiedTag> breakdown = TagClassifier.classifyAll(note.tags());
    int functional = (int) breakdown.stream().filter(ClassifiedTag::functional).count();
    int topic = breakdown.size() - functional;

    int score = 0;
    if (functional > 0 && topic == 0) {
      score = 2;
    } else if (functional > 0) {
      score = 1;
    }

    return new TaxonomyScore(
        score,
        note.tags().size(),
        functional,
        topic,
        breakdown,
        hasCategory(breakdown, TagCategory.ACTION),
        hasCategory(breakdown, TagCategory.SKILL),
        hasCategory(breakdown, TagCategory.EVOLUTION),
        hasCategory(breakdown, TagCategory.PROJECT),
        note.tags().size() > TAG_LIMIT);
  }

  /** Connectivity (0-2): an upward and a sideways link give 2, either one alone gives 1. */
  public static ConnectivityScore scoreConnectivity(
      QualityNote note, ConnectionClassifier classifier) {
    List<ClassifiedConnection> classified =
        classifier.classify(note.connections(), note.content());
    List<ClassifiedConnection> upward = withDirection(classified, ConnectionDirection.UPWARD);
    List<ClassifiedConnection> sideways = withDirection(classified, ConnectionDirection.SIDEWAYS);

    boolean hasUpward = !upward.isEmpty();
    boolean hasSideways = !sideways.isEmpty();
    boolean meetsMinimum = hasUpward && hasSideways;
    int score = meetsMinimum ? 2 : hasUpward || hasSideways ? 1 : 0;

    return new ConnectivityScore(
        score, hasUpward, upward, hasSideways, sideways, note.connections().size(), meetsMinimum);
  }

  /**
   * Originality (0-1): 1 when the note shows original insight and does not read as an
   * encyclopedic fact.
   */
  public static OriginalityScore scoreOriginality(QualityNote note) {
    String text = note.title() + " " + note.content();

    long insightMatches = countMatches(text, ORIGINAL_INSIGHT);
    long factMatches = countMatches(text, WIKIPEDIA_FACT);
    boolean wikipediaFact = factMatches > 0 && insightMatches < 2;

    double ratio = synthesisRatio(text);
    boolean insight = insightMatches >= 2 || ratio > SYNTHESIS_THRESHOLD;
    int score = insight && !wikipediaFact ? 1 : 0;

    String reasoning;
    if (wikipediaFact) {
      reasoning = "Contains primarily factual/encyclopedic content";
    } else if (insight) {
      reasoning = "Contains original interpretation and synthesis";
    } else {
      reasoning = "Mostly factual, lacks personal synthesis";
    }
    return new OriginalityScore(score, ratio, insight, wikipediaFact, reasoning);
  }

  /**
   * Share of characters outside long quotations, blockquotes and code fences. Overlapping quoted
   * regions are counted once.
   *
   * @return a value in [0, 1]; 0 for empty text
   */
  public static double synthesisRatio(String text) {
    if (text.isEmpty()) {
      return 0.0;
    }
    boolean[] quoted = new boolean[text.length()];
    for (Pattern pattern : QUOTATIONS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        for (int i = matcher.start(); i < matcher.end(); i++) {
          quoted[i] = true;
        }
      }
    }
    int quotedChars = 0;
    for (boolean q : quoted) {
      if (q) {
        quotedChars++;
      }
    }
    return (double) (text.length() - quotedChars) / text.length();
  }

  static boolean linksToGoal(String text, List<Goal> goals) {
    String lower = text.toLowerCase(Locale.ROOT);
    for (Goal goal : goals) {
      if (!goal.title().isBlank() && lower.contains(goal.title().toLowerCase(Locale.ROOT))) {
        return true;
      }
      String whyRoot = goal.whyRoot();
      if (whyRoot != null && !whyRoot.isBlank()
          && lower.contains(whyRoot.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }

  private static long countMatches(String text, List<Pattern> patterns) {
    return patterns.stream().filter(p -> p.matcher(text).find()).count();
  }

  private static boolean hasCategory(List<ClassifiedTag> tags, TagCategory category) {
    return tags.stream().anyMatch(t -> t.category() == category);
  }

  private static List<ClassifiedConnection> withDirection(
      List<ClassifiedConnection> connections, ConnectionDirection direction) {
    return connections.stream().filter(c -> c.direction() == direction).toList();
  }

  private static boolean isBlank(@Nullable String value) {
    return value == null || value.isBlank();
  }

  private static List<Pattern> caseInsensitive(String... regexes) {
    return Arrays.stream(regexes)
        .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
        .toList();
  }
}
