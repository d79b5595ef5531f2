package com.cycleindicators.common.scoring;

import com.cycleindicators.common.model.Bounds;

import java.util.OptionalDouble;

/**
 * Linear rescaling of a raw indicator value into [0, 1]:
 * <pre>
 *   normalized = clamp((raw − lower) / (upper − lower), 0, 1)
 * </pre>
 * Degenerate bounds ({@code lower == upper}) and non-finite raw values yield an empty result,
 * never an exception.
 */
public final class Normalizer {

    private Normalizer() {}

    public static OptionalDouble normalize(double raw, Bounds bounds) {
        if (bounds == null || bounds.isDegenerate() || !Double.isFinite(raw)) {
            return OptionalDouble.empty();
        }
        double normalized = (raw - bounds.lower()) / bounds.span();
        return OptionalDouble.of(Math.max(0.0, Math.min(1.0, normalized)));
    }
}
