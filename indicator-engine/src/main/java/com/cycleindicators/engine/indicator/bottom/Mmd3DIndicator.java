package com.cycleindicators.engine.indicator.bottom;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.indicator.AbstractIndicator;
import com.cycleindicators.common.indicator.DatasetReader;
import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.context.VolumeStatistics;
import com.cycleindicators.engine.series.SeriesMath;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Downside momentum descriptor across the 3-day, daily and weekly timeframes.
 *
 * <p>Per timeframe, the rate of change over {@code periods} bars is expressed as a z-score
 * against the rates of change inside the last {@code 2 × periods} bars (population std).
 * The combination {@code 0.6·z3D + 0.3·zD + 0.1·zW} is boosted by up to 20% with 3-day volume
 * and negated, so deeper declines read higher. Only the 3-day term is mandatory.
 */
@Component
@Order(30)
public class Mmd3DIndicator extends AbstractIndicator {

    public static final String NAME = "3d_mmd";

    private static final double WEIGHT_3D     = 0.6;
    private static final double WEIGHT_DAILY  = 0.3;
    private static final double WEIGHT_WEEKLY = 0.1;
    private static final int VOLUME_PERIODS   = 20;

    public Mmd3DIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.BOTTOM; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        TimeframeDataset threeDay = data.require("3D");
        OptionalDouble z3d = momentumZScore(threeDay, 10);
        if (z3d.isEmpty()) {
            throw new DataUnavailableException(NAME, "Failed to calculate 3D momentum from " + threeDay.size() + " bars");
        }

        double combined = z3d.getAsDouble() * WEIGHT_3D;
        OptionalDouble zDaily  = optionalMomentum(data.find("1D"), 14);
        OptionalDouble zWeekly = optionalMomentum(data.find("1W"), 4);
        if (zDaily.isPresent())  combined += zDaily.getAsDouble() * WEIGHT_DAILY;
        if (zWeekly.isPresent()) combined += zWeekly.getAsDouble() * WEIGHT_WEEKLY;

        VolumeStatistics volume = VolumeStatistics.of(threeDay.volumes(), VOLUME_PERIODS);
        double volumeFactor = Math.min(volume.zScore() / 2.0, 1.0);
        combined *= 1 + volumeFactor * 0.2;

        log.debug("3D MMD z3D={} zD={} zW={} volumeFactor={} combined={}",
                  z3d.getAsDouble(), zDaily, zWeekly, volumeFactor, combined);
        return OptionalDouble.of(-combined);
    }

    private static OptionalDouble optionalMomentum(Optional<TimeframeDataset> dataset, int periods) {
        return dataset.map(ds -> momentumZScore(ds, periods)).orElse(OptionalDouble.empty());
    }

    /** Empty when fewer than {@code periods + 1} bars; 0 when the window has no spread. */
    static OptionalDouble momentumZScore(TimeframeDataset dataset, int periods) {
        List<Double> closes = dataset.closes();
        if (closes.size() < periods + 1) {
            return OptionalDouble.empty();
        }
        double past = SeriesMath.back(closes, periods);
        double momentum = (SeriesMath.last(closes) - past) / past * 100.0;

        List<Double> recent = SeriesMath.tail(closes, periods * 2);
        List<Double> window = new ArrayList<>();
        for (int i = periods; i < recent.size(); i++) {
            double base = recent.get(i - periods);
            window.add((recent.get(i) - base) / base * 100.0);
        }
        if (window.isEmpty()) {
            return OptionalDouble.of(0.0);
        }
        double std = SeriesMath.populationStd(window);
        if (!(std > 0)) {
            return OptionalDouble.of(0.0);
        }
        return OptionalDouble.of((momentum - SeriesMath.mean(window)) / std);
    }
}
