package com.cycleindicators.common.indicator;

import com.cycleindicators.common.model.TimeframeDataset;

import java.util.Optional;

/**
 * Read access to market data by timeframe key. Implementations decide whether a call
 * is served from cache or triggers a fetch; callers only see a dataset or nothing.
 */
public interface TimeframeDataSource {

    Optional<TimeframeDataset> get(String timeframe);
}
