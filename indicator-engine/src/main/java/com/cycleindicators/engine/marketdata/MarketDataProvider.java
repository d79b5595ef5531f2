package com.cycleindicators.engine.marketdata;

import com.cycleindicators.common.model.TimeframeDataset;
import reactor.core.publisher.Mono;

/**
 * Source of market data for the timeframe cache. Implementations rate-limit themselves;
 * callers only decide when to ask.
 */
public interface MarketDataProvider {

    /**
     * Bars for {@code timeframe}, oldest first, at most {@code barCount} of them, with the
     * derived series the roster reads already attached. Errors with {@link MarketDataException}.
     */
    Mono<TimeframeDataset> fetchTimeframe(String timeframe, int barCount);

    /** Latest spot price; completes empty when no price source answered. */
    Mono<Double> currentPrice();
}
