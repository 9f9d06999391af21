package dev.vitality.accuracy;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised ground-truth configuration, bound from {@code vitality.accuracy.*}.
 *
 * <p>{@code synonym-groups} maps a canonical tag to variants that should have reused it. Keys
 * containing hyphens need bracket notation in YAML ({@code "[note-taking]"}). Defaults to {@link
 * TagReuseRules#DEFAULT_SYNONYMS}.
 */
@Configuration
@ConfigurationProperties(prefix = "vitality.accuracy")
public class AccuracyProperties {

  private Map<String, List<String>> synonymGroups =
      new LinkedHashMap<>(TagReuseRules.DEFAULT_SYNONYMS);

  @PostConstruct
  void validate() {
    synonymGroups.forEach(
        (canonical, variants) -> {
          if (canonical.isBlank()) {
            throw new IllegalStateException("vitality.accuracy.synonym-groups has a blank key");
          }
          if (variants == null || variants.isEmpty()) {
            throw new IllegalStateException(
                "vitality.accuracy.synonym-groups." + canonical + " must list variants");
          }
        });
  }

  public Map<String, List<String>> getSynonymGroups() {
    return synonymGroups;
  }

  public void setSynonymGroups(Map<String, List<String>> synonymGroups) {
    this.synonymGroups = synonymGroups;
  }
}
