package com.cycleindicators.engine.context;

import com.cycleindicators.common.model.OhlcvBar;
import com.cycleindicators.engine.series.SeriesMath;

import java.util.ArrayList;
import java.util.List;

/**
 * Close-price summary over the newest {@code periods} bars. {@code std} is the sample standard
 * deviation; {@code changePct} compares the newest close with the oldest close in the window.
 */
public record PriceStatistics(
    double current,
    double mean,
    double std,
    double high,
    double low,
    double changePct
) {

    public static PriceStatistics of(List<OhlcvBar> bars, int periods) {
        if (bars == null || bars.isEmpty()) {
            throw new IllegalArgumentException("Price statistics need at least one bar");
        }
        List<OhlcvBar> window = bars.subList(Math.max(0, bars.size() - periods), bars.size());
        List<Double> closes = new ArrayList<>(window.size());
        double high = Double.NEGATIVE_INFINITY;
        double low  = Double.POSITIVE_INFINITY;
        for (OhlcvBar bar : window) {
            closes.add(bar.close());
            high = Math.max(high, bar.high());
            low  = Math.min(low, bar.low());
        }
        double current = SeriesMath.last(closes);
        double first   = closes.get(0);
        double change  = first == 0 ? Double.NaN : (current - first) / first * 100.0;
        return new PriceStatistics(current, SeriesMath.mean(closes), SeriesMath.sampleStd(closes), high, low, change);
    }
}
