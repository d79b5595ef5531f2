package com.cycleindicators.engine.context;

import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.cache.TimeframeCache;
import com.cycleindicators.engine.marketdata.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/** Builds the {@link MarketContext} from the daily dataset and a spot-price lookup. */
@Component
public class MarketContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(MarketContextBuilder.class);

    static final String CONTEXT_TIMEFRAME = "1D";

    private final TimeframeCache cache;
    private final MarketDataProvider provider;
    private final Clock clock;
    private final int lookback;
    private final Duration priceTimeout;

    public MarketContextBuilder(TimeframeCache cache,
                                MarketDataProvider provider,
                                Clock clock,
                                @Value("${analysis.context-lookback:30}") int lookback,
                                @Value("${market-data.price-timeout:15s}") Duration priceTimeout) {
        this.cache        = cache;
        this.provider     = provider;
        this.clock        = clock;
        this.lookback     = lookback;
        this.priceTimeout = priceTimeout;
    }

    /** Never throws; a failure is reported through {@link MarketContext#error()}. */
    public MarketContext build() {
        try {
            Double price = currentPrice();
            Optional<TimeframeDataset> daily = cache.get(CONTEXT_TIMEFRAME);

            PriceStatistics priceStats   = null;
            VolumeStatistics volumeStats = null;
            if (daily.isPresent() && !daily.get().isEmpty()) {
                priceStats  = PriceStatistics.of(daily.get().bars(), lookback);
                volumeStats = VolumeStatistics.of(daily.get().volumes(), lookback);
            } else {
                log.warn("Market context without price/volume statistics: no {} data", CONTEXT_TIMEFRAME);
            }
            return new MarketContext(price, priceStats, volumeStats, clock.instant(), null);
        } catch (RuntimeException e) {
            log.error("Error building market context", e);
            return MarketContext.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private Double currentPrice() {
        try {
            return provider.currentPrice().blockOptional(priceTimeout).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Current price lookup failed: {}", e.getMessage());
            return null;
        }
    }
}
