package com.cycleindicators.engine.indicator.top;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.indicator.AbstractIndicator;
import com.cycleindicators.common.indicator.DatasetReader;
import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.series.SeriesMath;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Market momentum descriptor for tops. Momentum deteriorating across timeframes reads as
 * top risk on a 0.5 to 4 scale.
 *
 * <p>Per timeframe (1D over 14 bars, 1W over 8, 1M over 4) the momentum blends price rate of
 * change (0.5), volume against its average (0.2) and an RSI-like up/down ratio centred on 50
 * (0.3). Available timeframes are weighted 0.6 / 0.3 / 0.1 in that order (0.7 / 0.3 for two).
 * Rising daily prices with weak momentum boost the result by 1.3; rising prices with strong
 * momentum damp it by 0.8.
 */
@Component
@Order(125)
public class MmdIndicator extends AbstractIndicator {

    public static final String NAME = "mmd";

    private static final String[] TIMEFRAMES = {"1D", "1W", "1M"};
    private static final int[] PERIODS = {14, 8, 4};

    public MmdIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.TOP; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        List<Double> momenta = new ArrayList<>(TIMEFRAMES.length);
        for (int i = 0; i < TIMEFRAMES.length; i++) {
            int periods = PERIODS[i];
            data.find(TIMEFRAMES[i])
                .map(ds -> momentumBreadth(ds, periods))
                .orElse(OptionalDouble.empty())
                .ifPresent(momenta::add);
        }
        if (momenta.isEmpty()) {
            throw new DataUnavailableException(NAME, "Failed to calculate momentum for any timeframe");
        }

        double weighted = switch (momenta.size()) {
            case 3  -> momenta.get(0) * 0.6 + momenta.get(1) * 0.3 + momenta.get(2) * 0.1;
            case 2  -> momenta.get(0) * 0.7 + momenta.get(1) * 0.3;
            default -> momenta.get(0);
        };

        double adjusted = weighted * divergenceFactor(data.find("1D"), weighted);
        double score = Math.min(topScore(adjusted), 5.0);

        log.debug("MMD momenta={} weighted={} adjusted={} score={}", momenta, weighted, adjusted, score);
        return OptionalDouble.of(score);
    }

    /** Empty when the dataset has fewer than {@code periods + 5} bars. */
    static OptionalDouble momentumBreadth(TimeframeDataset dataset, int periods) {
        List<Double> closes = dataset.closes();
        if (closes.size() < periods + 5) {
            return OptionalDouble.empty();
        }
        List<Double> volumes = dataset.volumes();

        double priceMomentum = SeriesMath.percentChange(closes, periods);

        double avgVolume = SeriesMath.mean(SeriesMath.tail(volumes, periods));
        double volumeMomentum = avgVolume > 0 ? (SeriesMath.last(volumes) / avgVolume - 1) * 100 : 0;

        double gains = 0;
        double losses = 0;
        for (double change : SeriesMath.tail(SeriesMath.returns(closes), periods)) {
            if (change > 0) gains += change;
            else if (change < 0) losses -= change;
        }
        double strength = losses == 0 ? 100 : 100 - 100 / (1 + gains / losses);

        return OptionalDouble.of(priceMomentum * 0.5 + volumeMomentum * 0.2 + (strength - 50) * 0.3);
    }

    static double divergenceFactor(Optional<TimeframeDataset> daily, double momentum) {
        if (daily.isEmpty() || daily.get().size() < 20) {
            return 1.0;
        }
        double priceTrend = SeriesMath.slope(SeriesMath.tail(daily.get().closes(), 10));
        if (priceTrend > 0 && momentum < -5) return 1.3;
        if (priceTrend > 0 && momentum > 20) return 0.8;
        return 1.0;
    }

    static double topScore(double momentum) {
        if (momentum > 20)  return 0.5;
        if (momentum > 0)   return 1.0 + (20 - momentum) / 40;
        if (momentum > -20) return 2.0 + Math.abs(momentum) / 20;
        return 4.0;
    }
}
