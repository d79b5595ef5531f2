package com.cycleindicators.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Outcome of evaluating one indicator during one run.
 *
 * <p>{@code rawValue} and {@code normalizedScore} are {@code null} when the value is
 * unavailable. {@code normalizedScore} is non-null only when {@code rawValue} is non-null
 * and the bounds are non-degenerate. A failed result still reports {@code weight} and
 * {@code bounds} so it can be listed by name in the composite.
 *
 * <p>{@code bounds} is {@code null} only for an indicator with no configuration entry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndicatorResult(
    String name,
    Side side,
    Double rawValue,
    Double normalizedScore,
    double weight,
    Bounds bounds,
    Instant timestamp,
    String error
) {

    public static IndicatorResult valid(String name, Side side, double rawValue, double normalizedScore,
                                        double weight, Bounds bounds, Instant timestamp) {
        return new IndicatorResult(name, side, rawValue, normalizedScore, weight, bounds, timestamp, null);
    }

    /** Raw value present but not normalizable (degenerate bounds). */
    public static IndicatorResult unnormalized(String name, Side side, double rawValue,
                                               double weight, Bounds bounds, Instant timestamp, String error) {
        return new IndicatorResult(name, side, rawValue, null, weight, bounds, timestamp, error);
    }

    public static IndicatorResult failed(String name, Side side, double weight, Bounds bounds,
                                         Instant timestamp, String error) {
        return new IndicatorResult(name, side, null, null, weight, bounds, timestamp, error);
    }

    @JsonIgnore
    public boolean isValid() {
        return normalizedScore != null;
    }
}
