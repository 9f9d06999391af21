package dev.vitality.quality;

import dev.vitality.nvq.NvqComponent;

/** How many notes failed a component for the same reason. */
public record FailureCount(NvqComponent component, String issue, int count) {}
