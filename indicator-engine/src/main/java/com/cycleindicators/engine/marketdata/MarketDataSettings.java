package com.cycleindicators.engine.marketdata;

import java.time.Duration;

/** Request parameters and self-rate-limiting knobs for {@link MarketDataWebClient}. */
public record MarketDataSettings(
    String apiKey,
    String symbol,
    String market,
    String priceCoinId,
    Duration minCallInterval,
    int maxRetries,
    Duration retryBackoff
) {}
