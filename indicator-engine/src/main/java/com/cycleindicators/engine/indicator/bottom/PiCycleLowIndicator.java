package com.cycleindicators.engine.indicator.bottom;

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
 * Pi Cycle Low: 0.745 × the 150-day close MA against the 471-day close MA, scored 0 to 1.
 *
 * <pre>
 *   crossover   0.4   pi line crossing above support in the last 20 bars, 0.8 × recency
 *   position    0.3   pi / support ratio, 0 at 0.995 rising to 1 at 1.005
 *   proximity   0.3   price near the pi line (1.0) or support (0.7) in a bullish setup, else 0.3
 * </pre>
 *
 * A crossover within the last ten bars multiplies the total by 1.2. Short histories shrink
 * both windows; a long window under 50 bars fails.
 */
@Component
@Order(50)
public class PiCycleLowIndicator extends AbstractIndicator {

    public static final String NAME = "pi_cycle_low";

    private static final int LONG_PERIOD     = 471;
    private static final int SHORT_PERIOD    = 150;
    private static final double MULTIPLIER   = 0.745;
    private static final int MIN_LONG_PERIOD = 50;
    private static final int CROSS_LOOKBACK  = 20;

    public PiCycleLowIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.BOTTOM; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        List<Double> closes = data.require("1D").closes();

        int longPeriod  = LONG_PERIOD;
        int shortPeriod = SHORT_PERIOD;
        if (closes.size() < LONG_PERIOD) {
            log.warn("Short history for Pi Cycle Low: need {} bars, have {}", LONG_PERIOD, closes.size());
            longPeriod  = Math.min(closes.size() - 1, LONG_PERIOD);
            shortPeriod = Math.min(SHORT_PERIOD, longPeriod / 2);
        }
        if (longPeriod < MIN_LONG_PERIOD) {
            throw new DataUnavailableException(NAME, String.format(
                "Insufficient 1D data: need %d bars, have %d", MIN_LONG_PERIOD + 1, closes.size()));
        }

        List<Double> piLine = SeriesMath.rollingMean(closes, shortPeriod);
        piLine.replaceAll(v -> v * MULTIPLIER);
        List<Double> support = SeriesMath.rollingMean(closes, longPeriod);

        double currentPi      = SeriesMath.last(piLine);
        double currentSupport = SeriesMath.last(support);
        double price          = SeriesMath.last(closes);

        List<Double> recentPi      = SeriesMath.tail(piLine, CROSS_LOOKBACK);
        List<Double> recentSupport = SeriesMath.tail(support, CROSS_LOOKBACK);
        double crossoverScore = 0.0;
        int daysSinceCrossover = Integer.MAX_VALUE;
        for (int i = 1; i < recentPi.size(); i++) {
            boolean crossed = recentPi.get(i - 1) <= recentSupport.get(i - 1)
                              && recentPi.get(i) > recentSupport.get(i);
            if (crossed) {
                int daysAgo = recentPi.size() - i;
                daysSinceCrossover = Math.min(daysSinceCrossover, daysAgo);
                double recency = Math.max(0, (CROSS_LOOKBACK - daysAgo) / (double) CROSS_LOOKBACK);
                crossoverScore = Math.max(crossoverScore, recency * 0.8);
            }
        }

        double ratio = currentPi / currentSupport;
        double position = Math.min(Math.max((ratio - 0.995) / 0.01, 0), 1);
        double proximity = proximityScore(ratio, price / currentPi, price / currentSupport);

        double score = crossoverScore * 0.4 + position * 0.3 + proximity * 0.3;
        if (daysSinceCrossover <= 10) {
            log.info("PI_CYCLE_LOW_CROSSOVER daysAgo={}", daysSinceCrossover);
            score *= 1.2;
        }
        score = Math.max(0, Math.min(1, score));

        log.debug("Pi Cycle Low price={} pi={} support={} ratio={} crossover={} position={} proximity={}",
                  price, currentPi, currentSupport, ratio, crossoverScore, position, proximity);
        return OptionalDouble.of(score);
    }

    static double proximityScore(double piToSupport, double priceToPi, double priceToSupport) {
        if (piToSupport <= 1.0) return 0.3;
        if (priceToPi >= 0.95 && priceToPi <= 1.05) return 1.0;
        if (priceToSupport >= 0.9 && priceToSupport <= 1.1) return 0.7;
        return Math.max(0, 1 - Math.abs(priceToPi - 1) * 2);
    }
}
