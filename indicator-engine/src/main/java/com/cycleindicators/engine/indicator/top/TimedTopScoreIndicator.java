package com.cycleindicators.engine.indicator.top;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.indicator.AbstractIndicator;
import com.cycleindicators.common.indicator.DatasetReader;
import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.indicator.ScheduleProximity;
import com.cycleindicators.engine.series.DerivedSeriesCalculator;
import com.cycleindicators.engine.series.SeriesMath;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Monthly timed top score: distribution, momentum exhaustion, RSI euphoria and volatility
 * expansion blended 0.30 / 0.30 / 0.25 / 0.15, then scaled by the calculation-slot factor
 * (1 on a slot, down to 0.7 six hours away). Missing components drop out of the blend.
 */
@Component
@Order(105)
public class TimedTopScoreIndicator extends AbstractIndicator {

    public static final String NAME = "m_timed_top_score";

    private static final double WEIGHT_DISTRIBUTION = 0.30;
    private static final double WEIGHT_MOMENTUM     = 0.30;
    private static final double WEIGHT_SENTIMENT    = 0.25;
    private static final double WEIGHT_VOLATILITY   = 0.15;

    private static final int DISTRIBUTION_MIN_BARS = 10;
    private static final int DISTRIBUTION_WINDOW   = 6;

    public TimedTopScoreIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.TOP; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        Optional<TimeframeDataset> daily = data.find("1D");
        OptionalDouble distribution = data.find("1M").map(TimedTopScoreIndicator::distributionComponent)
                                          .orElse(OptionalDouble.empty());
        OptionalDouble momentum     = momentumExhaustion(daily, data.find("1W"));
        OptionalDouble sentiment    = daily.map(TimedTopScoreIndicator::sentimentComponent)
                                           .orElse(OptionalDouble.empty());
        OptionalDouble volatility   = daily.map(TimedTopScoreIndicator::volatilityComponent)
                                           .orElse(OptionalDouble.empty());

        double weighted = 0;
        double totalWeight = 0;
        if (distribution.isPresent()) { weighted += distribution.getAsDouble() * WEIGHT_DISTRIBUTION; totalWeight += WEIGHT_DISTRIBUTION; }
        if (momentum.isPresent())     { weighted += momentum.getAsDouble() * WEIGHT_MOMENTUM;         totalWeight += WEIGHT_MOMENTUM; }
        if (sentiment.isPresent())    { weighted += sentiment.getAsDouble() * WEIGHT_SENTIMENT;       totalWeight += WEIGHT_SENTIMENT; }
        if (volatility.isPresent())   { weighted += volatility.getAsDouble() * WEIGHT_VOLATILITY;     totalWeight += WEIGHT_VOLATILITY; }
        if (totalWeight == 0) {
            throw new DataUnavailableException(NAME, "No valid components for the timed top score");
        }

        double base = weighted / totalWeight;
        double timeWeight = ScheduleProximity.weight(clock().instant(), 0.3, 0.7);

        log.debug("Timed top distribution={} momentum={} sentiment={} volatility={} base={} timeWeight={}",
                  distribution, momentum, sentiment, volatility, base, timeWeight);
        return OptionalDouble.of(base * timeWeight);
    }

    /** Rising price on falling volume over the last six months reads as distribution. */
    static OptionalDouble distributionComponent(TimeframeDataset monthly) {
        if (monthly.size() < DISTRIBUTION_MIN_BARS) return OptionalDouble.empty();
        double priceTrend  = SeriesMath.slope(SeriesMath.tail(monthly.closes(), DISTRIBUTION_WINDOW));
        double volumeTrend = SeriesMath.slope(SeriesMath.tail(monthly.volumes(), DISTRIBUTION_WINDOW));
        if (priceTrend > 0 && volumeTrend < 0) return OptionalDouble.of(0.9);
        if (priceTrend > 0 && volumeTrend > 0) return OptionalDouble.of(0.4);
        if (priceTrend < 0 && volumeTrend > 0) return OptionalDouble.of(0.7);
        return OptionalDouble.of(0.5);
    }

    /** Mean of the daily (14-bar) and weekly (4-bar) exhaustion scores that are available. */
    static OptionalDouble momentumExhaustion(Optional<TimeframeDataset> daily, Optional<TimeframeDataset> weekly) {
        double sum = 0;
        int count = 0;
        double dailyMomentum = daily.map(ds -> SeriesMath.percentChange(ds.closes(), 14)).orElse(Double.NaN);
        if (!Double.isNaN(dailyMomentum)) {
            if (dailyMomentum < -10)     sum += 0.8;
            else if (dailyMomentum < 5)  sum += 0.6;
            else if (dailyMomentum < 15) sum += 0.4;
            else                         sum += 0.2;
            count++;
        }
        double weeklyMomentum = weekly.map(ds -> SeriesMath.percentChange(ds.closes(), 4)).orElse(Double.NaN);
        if (!Double.isNaN(weeklyMomentum)) {
            if (weeklyMomentum < -5)      sum += 0.9;
            else if (weeklyMomentum < 10) sum += 0.6;
            else                          sum += 0.3;
            count++;
        }
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / count);
    }

    static OptionalDouble sentimentComponent(TimeframeDataset daily) {
        Optional<List<Double>> series = daily.series(DerivedSeriesCalculator.RSI);
        if (series.isEmpty() || series.get().isEmpty()) return OptionalDouble.of(0.5);
        double rsi = SeriesMath.last(series.get());
        if (Double.isNaN(rsi)) return OptionalDouble.empty();
        if (rsi >= 80) return OptionalDouble.of(1.0);
        if (rsi >= 70) return OptionalDouble.of(0.8);
        if (rsi >= 60) return OptionalDouble.of(0.6);
        if (rsi >= 50) return OptionalDouble.of(0.4);
        return OptionalDouble.of(0.2);
    }

    static OptionalDouble volatilityComponent(TimeframeDataset daily) {
        List<Double> closes = daily.closes();
        if (closes.size() < 30) return OptionalDouble.empty();
        double r = SeriesMath.volatilityRatio(closes, 10, 30);
        if (Double.isNaN(r)) return OptionalDouble.of(0.5);
        if (r >= 2.0) return OptionalDouble.of(0.8);
        if (r >= 1.5) return OptionalDouble.of(0.6);
        if (r >= 1.2) return OptionalDouble.of(0.5);
        return OptionalDouble.of(0.3);
    }
}
