package com.cycleindicators.engine.indicator.bottom;

import com.cycleindicators.common.config.IndicatorConfiguration;
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
 * Z-score of the mean daily volume over the last two days against the 20 days before them.
 * A volume burst inside a decline often marks capitulation.
 */
@Component
@Order(10)
public class VolumeBurst2DIndicator extends AbstractIndicator {

    public static final String NAME = "2d_volume_burst";

    private static final int BURST_DAYS = 2;
    private static final int LOOKBACK   = 20;

    public VolumeBurst2DIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.BOTTOM; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        List<Double> volumes = data.require("1D", LOOKBACK + BURST_DAYS).volumes();
        int n = volumes.size();

        double burstMean = SeriesMath.mean(volumes.subList(n - BURST_DAYS, n));
        List<Double> history = volumes.subList(n - BURST_DAYS - LOOKBACK, n - BURST_DAYS);
        double mean = SeriesMath.mean(history);
        double std  = SeriesMath.sampleStd(history);

        if (std == 0) {
            log.warn("Zero volume standard deviation over the last {} days", LOOKBACK);
            return OptionalDouble.of(0.0);
        }
        double z = (burstMean - mean) / std;
        log.debug("2D avg volume={} historical avg={} z={}", burstMean, mean, z);
        return OptionalDouble.of(z);
    }
}
