package dev.vitality.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/** Reads an {@link EvaluationSuite} from the classpath or the filesystem. */
@Component
public class SuiteLoader {

  private static final Logger log = LoggerFactory.getLogger(SuiteLoader.class);

  static final String CLASSPATH_PREFIX = "classpath:";

  private final ObjectMapper objectMapper;

  public SuiteLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Loads a suite.
   *
   * @param location {@code classpath:path/in/jar.json} or a filesystem path
   * @throws IOException if the location cannot be read or does not hold a valid suite
   */
  public EvaluationSuite load(String location) throws IOException {
    EvaluationSuite suite;
    try (InputStream is = open(location)) {
      suite = objectMapper.readValue(is, EvaluationSuite.class);
    }
    log.info(
        "Loaded suite from {} with {} scenarios and {} runs",
        location,
        suite.scenarios().size(),
        suite.runs().size());
    return suite;
  }

  private static InputStream open(String location) throws IOException {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return new ClassPathResource(location.substring(CLASSPATH_PREFIX.length())).getInputStream();
    }
    return Files.newInputStream(Path.of(location));
  }
}
