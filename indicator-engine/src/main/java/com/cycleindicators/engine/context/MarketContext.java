package com.cycleindicators.engine.context;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Market snapshot attached to every analysis run. Either statistics block may be absent when
 * its data was unavailable; a context that could not be built at all carries only {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MarketContext(
    Double currentPrice,
    PriceStatistics priceStatistics,
    VolumeStatistics volumeStatistics,
    Instant dataTimestamp,
    String error
) {
    public static MarketContext error(String error) {
        return new MarketContext(null, null, null, null, error);
    }
}
