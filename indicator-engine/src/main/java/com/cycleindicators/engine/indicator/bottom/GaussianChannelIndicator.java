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
 * Distance of the daily close below a 20-bar Gaussian-weighted moving average, in population
 * standard deviations of the same window. Reported as {@code (GMA − close) / std} so that
 * deeper oversold readings are higher.
 */
@Component
@Order(25)
public class GaussianChannelIndicator extends AbstractIndicator {

    public static final String NAME = "gaussian_channel";

    private static final int MIN_BARS  = 30;
    private static final int PERIOD    = 20;
    private static final double SIGMA  = 2.0;

    public GaussianChannelIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.BOTTOM; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        List<Double> window = SeriesMath.tail(data.require("1D", MIN_BARS).closes(), PERIOD);

        double gma = gaussianAverage(window, SIGMA);
        double std = SeriesMath.populationStd(window);
        if (!(std > 0)) {
            throw new DataUnavailableException(NAME, "No price spread in the last " + PERIOD + " bars");
        }
        double price = SeriesMath.last(window);
        double distance = (gma - price) / std;

        log.debug("Gaussian Channel price={} gma={} std={} distance={}", price, gma, std, distance);
        return OptionalDouble.of(distance);
    }

    /**
     * Window values (oldest first) weighted by a normal density centred on {@code size / 2}
     * with deviation {@code sigma}; the weights sum to one.
     */
    static double gaussianAverage(List<Double> window, double sigma) {
        int size = window.size();
        double centre = size / 2.0;
        double weightSum = 0;
        double weighted = 0;
        for (int i = 0; i < size; i++) {
            double z = (i - centre) / sigma;
            double weight = Math.exp(-0.5 * z * z);
            weightSum += weight;
            weighted += weight * window.get(i);
        }
        return weighted / weightSum;
    }
}
