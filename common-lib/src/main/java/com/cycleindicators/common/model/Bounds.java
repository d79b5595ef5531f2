package com.cycleindicators.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Normalization range for one indicator's raw value.
 * A well-formed range has {@code lower < upper}; {@code lower == upper} is degenerate.
 */
public record Bounds(double lower, double upper) {

    public static Bounds of(double lower, double upper) {
        return new Bounds(lower, upper);
    }

    @JsonIgnore
    public boolean isDegenerate() {
        return Double.compare(lower, upper) == 0;
    }

    public double span() {
        return upper - lower;
    }
}
