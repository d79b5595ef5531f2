package com.cycleindicators.engine.indicator.bottom;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.indicator.AbstractIndicator;
import com.cycleindicators.common.indicator.DatasetReader;
import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.context.VolumeStatistics;
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
 * Monthly timed bottom score: a weighted blend of four [0, 1] components, scaled by
 * how close the evaluation is to a calculation slot.
 *
 * <pre>
 *   momentum     0.35   1M 3-bar momentum, (tanh(−m / 20) + 1) / 2
 *   volatility   0.25   1D 10-bar vs 30-bar return std, capitulation band 1.5 to 3 scores 1
 *   volume       0.25   1D 20-bar volume z-score
 *   rsi          0.15   1D RSI, oversold scores 1
 * </pre>
 * Missing components drop out and the remaining weights are renormalized. The slot factor
 * falls from 1 to 0.5 over six hours.
 */
@Component
@Order(5)
public class TimedBottomScoreIndicator extends AbstractIndicator {

    public static final String NAME = "m_timed_bottom_score";

    private static final double WEIGHT_MOMENTUM   = 0.35;
    private static final double WEIGHT_VOLATILITY = 0.25;
    private static final double WEIGHT_VOLUME     = 0.25;
    private static final double WEIGHT_RSI        = 0.15;

    public TimedBottomScoreIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.BOTTOM; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        Optional<TimeframeDataset> daily = data.find("1D");
        OptionalDouble momentum   = data.find("1M").map(TimedBottomScoreIndicator::momentumComponent)
                                        .orElse(OptionalDouble.empty());
        OptionalDouble volatility = daily.map(TimedBottomScoreIndicator::volatilityComponent)
                                         .orElse(OptionalDouble.empty());
        OptionalDouble volume     = daily.map(TimedBottomScoreIndicator::volumeComponent)
                                         .orElse(OptionalDouble.empty());
        OptionalDouble rsi        = daily.map(TimedBottomScoreIndicator::rsiComponent)
                                         .orElse(OptionalDouble.empty());

        double weighted = 0;
        double totalWeight = 0;
        if (momentum.isPresent())   { weighted += momentum.getAsDouble() * WEIGHT_MOMENTUM;     totalWeight += WEIGHT_MOMENTUM; }
        if (volatility.isPresent()) { weighted += volatility.getAsDouble() * WEIGHT_VOLATILITY; totalWeight += WEIGHT_VOLATILITY; }
        if (volume.isPresent())     { weighted += volume.getAsDouble() * WEIGHT_VOLUME;         totalWeight += WEIGHT_VOLUME; }
        if (rsi.isPresent())        { weighted += rsi.getAsDouble() * WEIGHT_RSI;               totalWeight += WEIGHT_RSI; }
        if (totalWeight == 0) {
            throw new DataUnavailableException(NAME, "No valid components for the timed bottom score");
        }

        double base = weighted / totalWeight;
        double timeWeight = ScheduleProximity.weight(clock().instant(), 0.5, 0.5);

        log.debug("Timed bottom momentum={} volatility={} volume={} rsi={} base={} timeWeight={}",
                  momentum, volatility, volume, rsi, base, timeWeight);
        return OptionalDouble.of(base * timeWeight);
    }

    static OptionalDouble momentumComponent(TimeframeDataset monthly) {
        double momentum = SeriesMath.percentChange(monthly.closes(), 3);
        if (Double.isNaN(momentum)) return OptionalDouble.empty();
        return OptionalDouble.of((Math.tanh(-momentum / 20.0) + 1) / 2);
    }

    static OptionalDouble volatilityComponent(TimeframeDataset daily) {
        List<Double> closes = daily.closes();
        if (closes.size() < 30) return OptionalDouble.empty();
        double r = SeriesMath.volatilityRatio(closes, 10, 30);
        if (Double.isNaN(r)) return OptionalDouble.of(0.5);
        if (r <= 1.5) return OptionalDouble.of(r / 1.5);
        if (r <= 3.0) return OptionalDouble.of(1.0);
        return OptionalDouble.of(Math.max(0.5, 1.0 - (r - 3.0) / 5.0));
    }

    static OptionalDouble volumeComponent(TimeframeDataset daily) {
        if (daily.isEmpty()) return OptionalDouble.empty();
        double z = VolumeStatistics.of(daily.volumes(), 20).zScore();
        if (z >= 2.0) return OptionalDouble.of(1.0);
        if (z >= 1.0) return OptionalDouble.of(0.8);
        if (z >= 0)   return OptionalDouble.of(0.6);
        return OptionalDouble.of(Math.max(0.2, 0.6 + z * 0.2));
    }

    static OptionalDouble rsiComponent(TimeframeDataset daily) {
        Optional<List<Double>> series = daily.series(DerivedSeriesCalculator.RSI);
        if (series.isEmpty() || series.get().isEmpty()) return OptionalDouble.of(0.5);
        double rsi = SeriesMath.last(series.get());
        if (Double.isNaN(rsi)) return OptionalDouble.empty();
        if (rsi <= 30) return OptionalDouble.of(1.0);
        if (rsi <= 40) return OptionalDouble.of(0.8);
        if (rsi <= 50) return OptionalDouble.of(0.6);
        return OptionalDouble.of(Math.max(0.2, (100 - rsi) / 50));
    }
}
