package com.cycleindicators.engine.cache;

import com.cycleindicators.common.model.TimeframeDataset;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry wrapping a {@link TimeframeDataset} with its fetch timestamp.
 * A refresh replaces the whole entry.
 */
public record CacheEntry(
    TimeframeDataset dataset,
    Instant fetchedAt
) {

    /** Usable without refetch: fetched no later than {@code now} and younger than {@code maxAge}. */
    public boolean isValidAt(Instant now, Duration maxAge) {
        return !isFutureDated(now) && ageAt(now).compareTo(maxAge) < 0;
    }

    public boolean isFutureDated(Instant now) {
        return fetchedAt.isAfter(now);
    }

    public Duration ageAt(Instant now) {
        return Duration.between(fetchedAt, now);
    }
}
