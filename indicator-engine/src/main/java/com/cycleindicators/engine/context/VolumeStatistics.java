package com.cycleindicators.engine.context;

import com.cycleindicators.engine.series.SeriesMath;

import java.util.List;

/**
 * Volume summary over the newest {@code periods} values.
 *
 * <p>{@code zScore} is (current − mean) / sample std, 0 when the window has no spread.
 * {@code percentile} is the share of window values strictly below the current one, in [0, 100].
 */
public record VolumeStatistics(
    double current,
    double mean,
    double std,
    double zScore,
    double percentile
) {

    public static VolumeStatistics of(List<Double> volumes, int periods) {
        if (volumes == null || volumes.isEmpty()) {
            throw new IllegalArgumentException("Volume statistics need at least one value");
        }
        List<Double> window = SeriesMath.tail(volumes, periods);
        double current = SeriesMath.last(volumes);
        double mean    = SeriesMath.mean(window);
        double std     = SeriesMath.sampleStd(window);
        double z       = Double.isFinite(std) && std > 0 ? (current - mean) / std : 0.0;

        int below = 0;
        for (double v : window) {
            if (current > v) below++;
        }
        return new VolumeStatistics(current, mean, std, z, below * 100.0 / window.size());
    }
}
