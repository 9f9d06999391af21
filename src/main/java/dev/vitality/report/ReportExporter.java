package dev.vitality.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vitality.accuracy.ExtractionMetrics;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Writes reports to disk for tracking accuracy across extraction changes.
 *
 * <p>Produces two files per report: {@code extraction-accuracy-<runId>.json} with the full
 * pretty-printed report, and {@code extraction-accuracy-<runId>-strategies.csv} with one row of
 * headline metrics per strategy.
 */
@Service
public class ReportExporter {

  private static final String STRATEGY_HEADER =
      "strategy,f1_score,precision,recall,consolidation_accuracy,tag_reuse_rate,"
          + "connection_precision,connection_recall,avg_total_ms";

  private final Path outputDir;
  private final ObjectMapper objectMapper;

  public ReportExporter(
      @Value("${vitality.eval.output-dir:${user.home}/.vitality/eval}") String outputDir,
      ObjectMapper objectMapper) {
    if (outputDir == null || outputDir.isBlank()) {
      throw new IllegalStateException("vitality.eval.output-dir must not be blank");
    }
    this.outputDir = Path.of(outputDir);
    this.objectMapper = objectMapper;
  }

  /**
   * Exports the report as JSON and a per-strategy CSV.
   *
   * @return the paths written, JSON first
   * @throws IOException if the directory cannot be created or a file cannot be written
   */
  public List<Path> export(TestReport report) throws IOException {
    Files.createDirectories(outputDir);

    Path jsonPath = outputDir.resolve("extraction-accuracy-%s.json".formatted(report.runId()));
    Path csvPath =
        outputDir.resolve("extraction-accuracy-%s-strategies.csv".formatted(report.runId()));

    objectMapper.writerWithDefaultPrettyPrinter().writeValue(jsonPath.toFile(), report);
    writeStrategyCsv(report.byStrategy(), csvPath);
    return List.of(jsonPath, csvPath);
  }

  public Path outputDir() {
    return outputDir;
  }

  private static void writeStrategyCsv(Map<String, ExtractionMetrics> strategies, Path path)
      throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path)) {
      writer.write(STRATEGY_HEADER);
      writer.newLine();
      for (Map.Entry<String, ExtractionMetrics> entry : strategies.entrySet()) {
        ExtractionMetrics m = entry.getValue();
        writer.write(
            String.format(
                Locale.US,
                "%s,%.4f,%.4f,%.4f,%.4f,%.4f,%.4f,%.4f,%.1f",
                escapeCsv(entry.getKey()),
                m.duplicateDetection().f1Score(),
                m.duplicateDetection().precision(),
                m.duplicateDetection().recall(),
                m.consolidation().accuracy(),
                m.tagReuse().reuseRate(),
                m.connections().precision(),
                m.connections().recall(),
                m.timing().totalMs()));
        writer.newLine();
      }
    }
  }

  private static String escapeCsv(String value) {
    if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
