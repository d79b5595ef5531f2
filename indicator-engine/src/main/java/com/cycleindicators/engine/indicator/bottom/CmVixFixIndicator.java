package com.cycleindicators.engine.indicator.bottom;

import com.cycleindicators.common.config.IndicatorConfiguration;
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
import java.util.OptionalDouble;

/**
 * Williams VIX Fix on daily bars: {@code (highest close over 22 bars − low) / highest close × 100},
 * smoothed as the mean of the readings ending on each of the last three bars.
 */
@Component
@Order(20)
public class CmVixFixIndicator extends AbstractIndicator {

    public static final String NAME = "cm_vix_fix";

    private static final int PERIOD    = 22;
    private static final int SMOOTHING = 3;

    public CmVixFixIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.BOTTOM; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        TimeframeDataset daily = data.require("1D", PERIOD + SMOOTHING - 1);
        List<Double> closes = daily.closes();
        List<Double> lows   = daily.lows();
        int n = closes.size();

        List<Double> readings = new ArrayList<>(SMOOTHING);
        for (int offset = 0; offset < SMOOTHING; offset++) {
            int end = n - offset;
            double highestClose = SeriesMath.max(closes.subList(end - PERIOD, end));
            double low = lows.get(end - 1);
            if (highestClose > 0) {
                readings.add((highestClose - low) / highestClose * 100.0);
            }
        }
        if (readings.isEmpty()) {
            log.warn("No positive highest close in the last {} bars", PERIOD);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(SeriesMath.mean(readings));
    }
}
