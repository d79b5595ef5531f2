package com.cycleindicators.common.indicator;

import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.model.TimeframeDataset;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-evaluation view over a {@link TimeframeDataSource}. Remembers the freshest
 * {@code asOf} among the datasets consulted so the result can be timestamped with it.
 *
 * <p>Not thread-safe; one instance per indicator evaluation.
 */
public final class DatasetReader {

    private final TimeframeDataSource source;
    private final String indicatorName;
    private Instant freshest;

    public DatasetReader(TimeframeDataSource source, String indicatorName) {
        this.source        = source;
        this.indicatorName = indicatorName;
    }

    /** Dataset for {@code timeframe} if available; missing data is not an error here. */
    public Optional<TimeframeDataset> find(String timeframe) {
        Optional<TimeframeDataset> dataset = source.get(timeframe);
        dataset.ifPresent(this::touch);
        return dataset;
    }

    /**
     * @throws DataUnavailableException when the dataset is missing
     */
    public TimeframeDataset require(String timeframe) {
        return find(timeframe).orElseThrow(() ->
            new DataUnavailableException(indicatorName, "No " + timeframe + " data available"));
    }

    /**
     * @throws DataUnavailableException when the dataset is missing or has fewer than {@code minBars} bars
     */
    public TimeframeDataset require(String timeframe, int minBars) {
        TimeframeDataset dataset = require(timeframe);
        if (dataset.size() < minBars) {
            throw new DataUnavailableException(indicatorName, String.format(
                "Insufficient %s data: need %d bars, have %d", timeframe, minBars, dataset.size()));
        }
        return dataset;
    }

    /**
     * @throws DataUnavailableException when the dataset lacks the derived series
     */
    public List<Double> requireSeries(TimeframeDataset dataset, String seriesName) {
        return dataset.series(seriesName).orElseThrow(() -> new DataUnavailableException(indicatorName,
            "Derived series '" + seriesName + "' not available in " + dataset.timeframe() + " data"));
    }

    public Optional<Instant> freshest() {
        return Optional.ofNullable(freshest);
    }

    private void touch(TimeframeDataset dataset) {
        if (freshest == null || dataset.asOf().isAfter(freshest)) {
            freshest = dataset.asOf();
        }
    }
}
