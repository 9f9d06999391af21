package dev.vitality.nvq;

import dev.vitality.note.NoteConnection;
import dev.vitality.parse.NoteFieldParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classifies a note's links as upward, sideways or downward.
 *
 * <p>A link is upward when its target names a configured MOC or project, or contains "moc",
 * "map of content" or {@code project/} anywhere, case-insensitive. Otherwise links typed
 * {@code example_of} are downward and the rest are sideways.
 */
public class ConnectionClassifier {

  static final String CONTENT_LINK_TYPE = "reference";
  static final String EXAMPLE_OF = "example_of";

  private static final Pattern MOC_LINK =
      Pattern.compile("\\[\\[(MOC|Map of Content)[/:]?[^\\]]*\\]\\]", Pattern.CASE_INSENSITIVE);
  private static final Pattern PROJECT_LINK =
      Pattern.compile("\\[\\[Project[/:][^\\]]+\\]\\]", Pattern.CASE_INSENSITIVE);

  private final List<String> mocs;
  private final List<String> projects;

  public ConnectionClassifier(List<String> mocs, List<String> projects) {
    this.mocs = lowerNonBlank(mocs);
    this.projects = lowerNonBlank(projects);
  }

  public static ConnectionClassifier from(NvqEvaluatorConfig config) {
    return new ConnectionClassifier(config.mocs(), config.projects());
  }

  /**
   * Classifies explicit connections followed by every {@code [[wikilink]]} found in the content.
   */
  public List<ClassifiedConnection> classify(List<NoteConnection> connections, String content) {
    List<ClassifiedConnection> classified = new ArrayList<>();
    for (NoteConnection connection : connections) {
      classified.add(classify(connection.targetTitle(), connection.type()));
    }
    for (String link : NoteFieldParser.wikilinks(content)) {
      classified.add(classify(link, CONTENT_LINK_TYPE));
    }
    return classified;
  }

  public ClassifiedConnection classify(String targetTitle, String type) {
    String target = targetTitle.toLowerCase(Locale.ROOT);
    boolean toMoc =
        containsAny(target, mocs)
            || target.contains("moc")
            || target.contains("map of content")
            || MOC_LINK.matcher(targetTitle).find();
    boolean toProject =
        containsAny(target, projects)
            || target.contains("project/")
            || PROJECT_LINK.matcher(targetTitle).find();

    ConnectionDirection direction;
    if (toMoc || toProject) {
      direction = ConnectionDirection.UPWARD;
    } else if (EXAMPLE_OF.equalsIgnoreCase(type)) {
      direction = ConnectionDirection.DOWNWARD;
    } else {
      direction = ConnectionDirection.SIDEWAYS;
    }
    return new ClassifiedConnection(targetTitle, type, direction, toMoc, toProject);
  }

  private static boolean containsAny(String target, List<String> names) {
    for (String name : names) {
      if (target.contains(name)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> lowerNonBlank(List<String> names) {
    return names.stream()
        .filter(name -> name != null && !name.isBlank())
        .map(name -> name.trim().toLowerCase(Locale.ROOT))
        .toList();
  }
}
