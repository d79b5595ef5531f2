package com.cycleindicators.engine.indicator.top;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.indicator.AbstractIndicator;
import com.cycleindicators.common.indicator.DatasetReader;
import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.series.DerivedSeriesCalculator;
import com.cycleindicators.engine.series.SeriesMath;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Bollinger Band Width Percentile on daily bars: the share of the last 100 band widths
 * below the current one, in [0, 100]. With fewer widths the window shrinks to all but the
 * newest, never under 20. High readings are amplified above the 20-day mean and damped below it.
 */
@Component
@Order(120)
public class BbwpIndicator extends AbstractIndicator {

    public static final String NAME = "bbwp";

    private static final int LOOKBACK     = 100;
    private static final int MIN_LOOKBACK = 20;
    private static final int TREND_PERIOD = 20;

    public BbwpIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.TOP; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        TimeframeDataset daily = data.require("1D");
        List<Double> widths = SeriesMath.finite(data.requireSeries(daily, DerivedSeriesCalculator.BB_WIDTH));

        int lookback = widths.size() < LOOKBACK ? Math.max(MIN_LOOKBACK, widths.size() - 1) : LOOKBACK;
        if (widths.size() < lookback) {
            throw new DataUnavailableException(NAME, String.format(
                "Insufficient band width history: need %d values, have %d", lookback, widths.size()));
        }

        double current = SeriesMath.last(widths);
        List<Double> window = SeriesMath.tail(widths, lookback);
        int below = 0;
        for (double w : window) {
            if (w < current) below++;
        }
        double percentile = below * 100.0 / window.size();

        List<Double> closes = daily.closes();
        if (closes.size() < TREND_PERIOD) {
            return OptionalDouble.of(percentile);
        }
        boolean uptrend = SeriesMath.last(closes) > SeriesMath.mean(SeriesMath.tail(closes, TREND_PERIOD));
        double multiplier = 1.0;
        if (percentile > 80) {
            multiplier = uptrend ? 1.2 : 0.8;
        }
        double adjusted = Math.min(100.0, percentile * multiplier);
        log.debug("BBWP width={} percentile={} trend={} adjusted={}",
                  current, percentile, uptrend ? "up" : "down", adjusted);
        return OptionalDouble.of(adjusted);
    }
}
