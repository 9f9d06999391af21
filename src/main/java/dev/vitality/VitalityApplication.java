package dev.vitality;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Vitality evaluation engine.
 *
 * <p>Runs without a web server. With {@code vitality.eval.run-on-startup=true} it evaluates the
 * configured suite, prints the report and exits with a non-zero status when accuracy thresholds
 * are missed.
 */
@SpringBootApplication
public class VitalityApplication {
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(VitalityApplication.class, args)));
  }
}
