package com.cycleindicators.common.model;

import java.util.Objects;

/**
 * Static per-indicator configuration: the unique name (also the configuration key),
 * the side it scores, its normalization bounds and its weight in the composite.
 */
public record IndicatorSpec(
    String name,
    Side side,
    Bounds bounds,
    double weight
) {
    public IndicatorSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(bounds, "bounds");
    }
}
