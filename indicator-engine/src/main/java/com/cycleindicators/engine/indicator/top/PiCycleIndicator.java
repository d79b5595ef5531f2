package com.cycleindicators.engine.indicator.top;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.indicator.AbstractIndicator;
import com.cycleindicators.common.indicator.DatasetReader;
import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.engine.series.SeriesMath;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Pi Cycle Top: the 111-day close MA against twice the 350-day close MA, scored 0 to 1.
 *
 * <pre>
 *   crossover     0.60   MA111 crossing above 2×MA350 in the last 30 bars, recency weighted
 *   position      0.25   MA111 / 2×MA350 ratio
 *   confirmation  0.15   price relative to MA111 while the signal is active
 * </pre>
 *
 * A crossover within the last five bars multiplies the total by 1.5. On short histories the
 * long window shrinks to the available bars; below 100 the indicator fails.
 */
@Component
@Order(130)
public class PiCycleIndicator extends AbstractIndicator {

    public static final String NAME = "pi_cycle";

    private static final int SHORT_PERIOD    = 111;
    private static final int LONG_PERIOD     = 350;
    private static final double MULTIPLIER   = 2.0;
    private static final int MIN_LONG_PERIOD = 100;
    private static final int CROSS_LOOKBACK  = 30;

    public PiCycleIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.TOP; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        List<Double> closes = data.require("1D").closes();

        int shortPeriod = SHORT_PERIOD;
        int longPeriod  = LONG_PERIOD;
        if (closes.size() < LONG_PERIOD) {
            log.warn("Short history for Pi Cycle: need {} bars, have {}", LONG_PERIOD, closes.size());
            longPeriod  = Math.min(closes.size() - 1, LONG_PERIOD);
            shortPeriod = Math.min(SHORT_PERIOD, longPeriod / 2);
        }
        if (longPeriod < MIN_LONG_PERIOD) {
            throw new DataUnavailableException(NAME, String.format(
                "Insufficient 1D data: need %d bars, have %d", MIN_LONG_PERIOD + 1, closes.size()));
        }

        List<Double> signal = SeriesMath.rollingMean(closes, shortPeriod);
        List<Double> resistance = SeriesMath.rollingMean(closes, longPeriod);
        resistance.replaceAll(v -> v * MULTIPLIER);

        double currentSignal     = SeriesMath.last(signal);
        double currentResistance = SeriesMath.last(resistance);
        double price             = SeriesMath.last(closes);

        List<Double> recentSignal     = SeriesMath.tail(signal, CROSS_LOOKBACK);
        List<Double> recentResistance = SeriesMath.tail(resistance, CROSS_LOOKBACK);
        double crossoverScore = 0.0;
        int daysSinceCrossover = Integer.MAX_VALUE;
        for (int i = 1; i < recentSignal.size(); i++) {
            boolean crossed = recentSignal.get(i - 1) <= recentResistance.get(i - 1)
                              && recentSignal.get(i) > recentResistance.get(i);
            if (crossed) {
                int daysAgo = recentSignal.size() - i;
                daysSinceCrossover = Math.min(daysSinceCrossover, daysAgo);
                crossoverScore = Math.max(crossoverScore,
                                          Math.max(0, (CROSS_LOOKBACK - daysAgo) / (double) CROSS_LOOKBACK));
            }
        }

        double ratio = currentSignal / currentResistance;
        double score = crossoverScore * 0.6 + positionScore(ratio) * 0.25
                       + confirmationScore(ratio, price / currentSignal) * 0.15;
        if (daysSinceCrossover <= 5) {
            log.info("PI_CYCLE_CROSSOVER daysAgo={}", daysSinceCrossover);
            score *= 1.5;
        }
        score = Math.max(0, Math.min(1, score));

        log.debug("Pi Cycle price={} ma{}={} 2xma{}={} ratio={} score={}",
                  price, shortPeriod, currentSignal, longPeriod, currentResistance, ratio, score);
        return OptionalDouble.of(score);
    }

    static double positionScore(double ratio) {
        if (ratio >= 1.0)  return 1.0;
        if (ratio >= 0.98) return 0.8;
        if (ratio >= 0.95) return 0.6;
        return Math.max(0, (ratio - 0.90) / 0.05);
    }

    static double confirmationScore(double ratio, double priceToSignal) {
        if (ratio < 1.0) return 0.3;
        return priceToSignal >= 1.0 ? 1.0 : 0.7;
    }
}
