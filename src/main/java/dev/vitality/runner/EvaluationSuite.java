package dev.vitality.runner;

import dev.vitality.accuracy.TestScenario;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Scenarios plus the extraction runs to judge against them. */
public record EvaluationSuite(List<TestScenario> scenarios, List<ExtractionRun> runs) {

  public EvaluationSuite {
    scenarios =
        scenarios == null
            ? List.of()
            : scenarios.stream().filter(Objects::nonNull).toList();
    runs = runs == null ? List.of() : runs.stream().filter(Objects::nonNull).toList();
  }

  public Optional<TestScenario> scenario(String name) {
    return scenarios.stream().filter(s -> s.name().equals(name)).findFirst();
  }
}
