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
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * WaveTrend oscillator on daily closes (channel 10, average 21), roughly −100 to +100.
 * A rising price with a falling WaveTrend over the last ten bars scales the reading by 1.2.
 */
@Component
@Order(127)
public class WavetrendOscillatorIndicator extends AbstractIndicator {

    public static final String NAME = "wavetrend_oscillator";

    private static final int MIN_BARS       = 50;
    private static final int CHANNEL_LENGTH = 10;
    private static final int AVERAGE_LENGTH = 21;
    private static final int TREND_WINDOW   = 10;

    public WavetrendOscillatorIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource,
                                        Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.TOP; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        List<Double> closes = data.require("1D", MIN_BARS).closes();
        List<Double> wavetrend = wavetrend(closes, CHANNEL_LENGTH, AVERAGE_LENGTH);

        double current = SeriesMath.last(wavetrend);
        if (!Double.isFinite(current)) {
            throw new DataUnavailableException(NAME, "WaveTrend calculation failed");
        }

        double wtTrend    = SeriesMath.slope(SeriesMath.tail(wavetrend, TREND_WINDOW));
        double priceTrend = SeriesMath.slope(SeriesMath.tail(closes, TREND_WINDOW));
        double factor = priceTrend > 0 && wtTrend < 0 ? 1.2 : 1.0;
        if (factor > 1.0) {
            log.info("WAVETREND_DIVERGENCE wt={} priceTrend={} wtTrend={}", current, priceTrend, wtTrend);
        }

        log.debug("WaveTrend current={} factor={}", current, factor);
        return OptionalDouble.of(current * factor);
    }

    /**
     * {@code EMA(ci, average)} where {@code ci = (p − EMA(p)) / (0.015 × EMA(|p − EMA(p)|))};
     * non-finite channel index values count as 0.
     */
    static List<Double> wavetrend(List<Double> prices, int channelLength, int averageLength) {
        List<Double> esa = SeriesMath.ema(prices, channelLength);
        List<Double> deviation = new ArrayList<>(prices.size());
        for (int i = 0; i < prices.size(); i++) {
            deviation.add(Math.abs(prices.get(i) - esa.get(i)));
        }
        List<Double> meanDeviation = SeriesMath.ema(deviation, channelLength);

        List<Double> channelIndex = new ArrayList<>(prices.size());
        for (int i = 0; i < prices.size(); i++) {
            double ci = (prices.get(i) - esa.get(i)) / (0.015 * meanDeviation.get(i));
            channelIndex.add(Double.isFinite(ci) ? ci : 0.0);
        }
        return SeriesMath.ema(channelIndex, averageLength);
    }
}
