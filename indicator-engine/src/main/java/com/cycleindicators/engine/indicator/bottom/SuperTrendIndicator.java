package com.cycleindicators.engine.indicator.bottom;

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
 * SuperTrend bottom score on daily bars, 0 to 1:
 * <pre>
 *   trend direction   up +0.40, down +0.10
 *   recent flip       down→up on the last bar +0.35, otherwise two or more flips in 5 bars +0.20
 *   distance to line  ≤1% +0.25, ≤2% +0.20, ≤5% +0.10
 * </pre>
 */
@Component
@Order(40)
public class SuperTrendIndicator extends AbstractIndicator {

    public static final String NAME = "supertrend";

    private static final int MIN_BARS   = 10;
    private static final int FLIP_BARS  = 5;

    public SuperTrendIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.BOTTOM; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        TimeframeDataset daily = data.require("1D", MIN_BARS);
        List<Double> line  = data.requireSeries(daily, DerivedSeriesCalculator.SUPERTREND);
        List<Double> trend = data.requireSeries(daily, DerivedSeriesCalculator.SUPERTREND_TREND);

        double currentLine  = SeriesMath.last(line);
        double currentTrend = SeriesMath.last(trend);
        if (Double.isNaN(currentLine) || Double.isNaN(currentTrend)) {
            throw new DataUnavailableException(NAME, "SuperTrend not established yet");
        }
        double price = daily.latest().close();

        List<Double> recent = SeriesMath.tail(trend, FLIP_BARS);
        int flips = 0;
        for (int i = 1; i < recent.size(); i++) {
            if (Double.compare(recent.get(i), recent.get(i - 1)) != 0) flips++;
        }
        double distancePct = Math.abs(price - currentLine) / price * 100.0;

        double score = 0.0;
        if (currentTrend == 1.0) score += 0.4;
        else if (currentTrend == -1.0) score += 0.1;

        if (flips > 0) {
            boolean turnedUp = SeriesMath.back(trend, 0) == 1.0 && SeriesMath.back(trend, 1) == -1.0;
            if (turnedUp) score += 0.35;
            else if (flips >= 2) score += 0.20;
        }

        if (distancePct <= 1.0) score += 0.25;
        else if (distancePct <= 2.0) score += 0.20;
        else if (distancePct <= 5.0) score += 0.10;

        log.debug("SuperTrend line={} price={} trend={} distancePct={} flips={} score={}",
                  currentLine, price, currentTrend, distancePct, flips, score);
        return OptionalDouble.of(score);
    }
}
