package com.cycleindicators.engine.indicator.top;

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
 * Distribution volume across the 3-day, daily and weekly timeframes.
 *
 * <p>Per timeframe the latest volume is z-scored against the newest 20 bars and read against
 * the 10-bar price direction: heavy volume into a rising market scores highest. Timeframe
 * scores are mixed 0.5/0.3/0.2 (or 0.7/0.3 with two, as-is with one), boosted when daily
 * volume sits in the upper percentiles of the last 30 days, and capped at 4.
 */
@Component
@Order(110)
public class Volume3DIndicator extends AbstractIndicator {

    public static final String NAME = "3d_volume";

    private static final List<String> TIMEFRAMES = List.of("3D", "1D", "1W");
    private static final int VOLUME_WINDOW   = 20;
    private static final int PRICE_WINDOW    = 10;
    private static final int PERCENTILE_DAYS = 30;
    private static final double MAX_SCORE    = 4.0;

    public Volume3DIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        super(configuration, dataSource, clock);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Side side() { return Side.TOP; }

    @Override
    protected OptionalDouble calculate(DatasetReader data) {
        List<Double> scores = new ArrayList<>(TIMEFRAMES.size());
        for (String timeframe : TIMEFRAMES) {
            Optional<TimeframeDataset> dataset = data.find(timeframe);
            if (dataset.isEmpty() || dataset.get().size() < VOLUME_WINDOW) {
                continue;
            }
            OptionalDouble score = timeframeScore(dataset.get());
            if (score.isPresent()) {
                scores.add(score.getAsDouble());
            }
        }
        if (scores.isEmpty()) {
            throw new DataUnavailableException(NAME, "No timeframe with enough volume history");
        }

        double weighted;
        if (scores.size() >= 3) {
            weighted = scores.get(0) * 0.5 + scores.get(1) * 0.3 + scores.get(2) * 0.2;
        } else if (scores.size() == 2) {
            weighted = scores.get(0) * 0.7 + scores.get(1) * 0.3;
        } else {
            weighted = scores.get(0);
        }

        Optional<TimeframeDataset> daily = data.find("1D");
        if (daily.isPresent() && !daily.get().isEmpty()) {
            double percentile = VolumeStatistics.of(daily.get().volumes(), PERCENTILE_DAYS).percentile();
            if (percentile > 80) weighted *= 1.3;
            else if (percentile > 60) weighted *= 1.1;
        }

        double score = Math.min(weighted, MAX_SCORE);
        log.debug("3D volume timeframeScores={} weighted={} final={}", scores, weighted, score);
        return OptionalDouble.of(score);
    }

    /** Empty when the volume window has no spread. */
    static OptionalDouble timeframeScore(TimeframeDataset dataset) {
        List<Double> volumes = dataset.volumes();
        List<Double> window = SeriesMath.tail(volumes, VOLUME_WINDOW);
        double std = SeriesMath.sampleStd(window);
        if (!(std > 0)) {
            return OptionalDouble.empty();
        }
        double z = (SeriesMath.last(volumes) - SeriesMath.mean(window)) / std;

        List<Double> closes = dataset.closes();
        if (closes.size() < PRICE_WINDOW) {
            return OptionalDouble.of(Math.max(0, z / 2.0));
        }
        double base = SeriesMath.back(closes, PRICE_WINDOW - 1);
        double priceChange = (SeriesMath.last(closes) - base) / base;

        if (priceChange > 0 && z > 1.5) return OptionalDouble.of(Math.min(z / 2.0, 4.0));
        if (priceChange > 0 && z > 0.5) return OptionalDouble.of(z);
        if (priceChange < 0 && z > 2.0) return OptionalDouble.of(Math.min(z / 1.5, 3.0));
        return OptionalDouble.of(Math.max(0, z / 2.0));
    }
}
