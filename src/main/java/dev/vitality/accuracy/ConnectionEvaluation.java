package dev.vitality.accuracy;

/** Connection counts for one extracted note against its matched expectation. */
public record ConnectionEvaluation(int correct, int missed, int spurious) {}
