package dev.vitality.accuracy;

/** Wall-clock timings reported by the extraction run, in milliseconds. */
public record Timing(double totalMs, double contextRetrievalMs, double extractionMs) {

  public static final Timing ZERO = new Timing(0, 0, 0);
}
