package dev.vitality.accuracy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the tag reuse rules from {@link AccuracyProperties}. */
@Configuration
public class AccuracyConfig {

  @Bean
  public TagReuseRules tagReuseRules(AccuracyProperties properties) {
    return new TagReuseRules(properties.getSynonymGroups());
  }
}
