package com.cycleindicators.engine.indicator.bottom;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.indicator.AbstractIndicator;
import com.cycleindicators.common.indicator.DatasetReader;
import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.OhlcvBar;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.series.DerivedSeriesCalculator;
import com.cycleindicators.engine.series.SeriesMath;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Five oscillators averaged with equal weight, each scaled to [0, 1] where high means
 * overbought:
 * <pre>
 *   stochastic_rsi     1M  RSI position inside its last 14 values
 *   rsi_ema            1M  EMA(9) of RSI / 100
 *   macd               1D  tanh(histogram / std of last 20) mapped to [0, 1]
 *   tdi                1M  EMA(8) of EMA(13) of RSI / 100
 *   acc_dist           1M  tanh of the 10-bar A/D line change / 10, mapped to [0, 1]
 * </pre>
 * Missing components are skipped. The result is {@code 1 − average}, so a deeply oversold
 * wavefront reads close to 1.
 */
@Component
@Order(35)
public class WavefrontIndicator extends AbstractIndicator {

    public static final String NAME = "w_wavefront";

    public WavefrontIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.BOTTOM; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        Optional<TimeframeDataset> monthly = data.find("1M");
        List<Double> monthlyRsi = monthly.flatMap(ds -> ds.series(DerivedSeriesCalculator.RSI))
                                         .map(SeriesMath::finite)
                                         .orElse(List.of());

        Map<String, OptionalDouble> components = new LinkedHashMap<>();
        components.put("stochastic_rsi", stochasticRsi(monthlyRsi, 14));
        components.put("rsi_ema", smoothedRsi(monthlyRsi));
        components.put("macd", data.find("1D").map(WavefrontIndicator::macdComponent).orElse(OptionalDouble.empty()));
        components.put("tdi", tdiGreenMean(monthlyRsi));
        components.put("acc_dist", monthly.map(ds -> accumulationDistribution(ds.bars())).orElse(OptionalDouble.empty()));

        double sum = 0;
        int count = 0;
        for (OptionalDouble value : components.values()) {
            if (value.isPresent()) {
                sum += value.getAsDouble();
                count++;
            }
        }
        if (count == 0) {
            throw new DataUnavailableException(NAME, "No wavefront components could be calculated");
        }
        double wavefront = sum / count;

        log.debug("Wavefront components={} wavefront={}", components, wavefront);
        return OptionalDouble.of(1.0 - wavefront);
    }

    static OptionalDouble stochasticRsi(List<Double> rsi, int period) {
        if (rsi.size() < period) return OptionalDouble.empty();
        List<Double> recent = SeriesMath.tail(rsi, period);
        double min = SeriesMath.min(recent);
        double max = SeriesMath.max(recent);
        if (max == min) return OptionalDouble.of(0.5);
        return OptionalDouble.of((SeriesMath.last(rsi) - min) / (max - min));
    }

    static OptionalDouble smoothedRsi(List<Double> rsi) {
        if (rsi.size() < 10) return OptionalDouble.empty();
        return OptionalDouble.of(SeriesMath.last(SeriesMath.ema(rsi, 9)) / 100.0);
    }

    static OptionalDouble tdiGreenMean(List<Double> rsi) {
        if (rsi.size() < 20) return OptionalDouble.empty();
        List<Double> smoothed = SeriesMath.ema(SeriesMath.ema(rsi, 13), 8);
        return OptionalDouble.of(SeriesMath.last(smoothed) / 100.0);
    }

    static OptionalDouble macdComponent(TimeframeDataset daily) {
        List<Double> histogram = daily.series(DerivedSeriesCalculator.MACD_HISTOGRAM)
                                      .map(SeriesMath::finite)
                                      .orElse(List.of());
        if (histogram.isEmpty()) return OptionalDouble.empty();
        double std = SeriesMath.sampleStd(SeriesMath.tail(histogram, 20));
        if (!(std > 0)) return OptionalDouble.empty();
        return OptionalDouble.of((Math.tanh(SeriesMath.last(histogram) / std) + 1) / 2);
    }

    /** Close-location value × volume, accumulated; bars with no range contribute nothing. */
    static OptionalDouble accumulationDistribution(List<OhlcvBar> bars) {
        if (bars.size() < 20) return OptionalDouble.empty();
        double[] line = new double[bars.size()];
        double running = 0;
        for (int i = 0; i < bars.size(); i++) {
            OhlcvBar bar = bars.get(i);
            double range = bar.high() - bar.low();
            double clv = range == 0 ? 0 : ((bar.close() - bar.low()) - (bar.high() - bar.close())) / range;
            running += clv * bar.volume();
            line[i] = running;
        }
        double current = line[line.length - 1];
        double past = line[line.length - 10];
        double change = past != 0 ? (current - past) / Math.abs(past) : 0;
        return OptionalDouble.of((Math.tanh(change / 10.0) + 1) / 2);
    }
}
