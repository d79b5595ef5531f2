package com.cycleindicators.engine.cache;

import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.marketdata.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory store of the latest {@link TimeframeDataset} per timeframe key.
 *
 * <p><strong>Fetch Once → Serve Many:</strong> an entry younger than {@code max-age} is served
 * without I/O. Otherwise the {@link MarketDataProvider} is asked; a successful fetch replaces
 * the whole entry, a failed one falls back to the previous entry if there is one.
 *
 * <p>Read-or-refresh-then-write runs under a per-timeframe lock so two callers seeing the same
 * stale entry trigger a single fetch. Entries stamped in the future relative to the clock are
 * never served.
 */
@Component
public class TimeframeCache implements TimeframeDataSource {

    private static final Logger log = LoggerFactory.getLogger(TimeframeCache.class);

    private final MarketDataProvider provider;
    private final Clock clock;
    private final List<String> timeframes;
    private final Duration maxAge;
    private final int barCount;
    private final Duration fetchTimeout;

    private final ConcurrentHashMap<String, CacheEntry> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public TimeframeCache(MarketDataProvider provider,
                          Clock clock,
                          @Value("${cache.timeframes:1D,3D,1W,1M}") List<String> timeframes,
                          @Value("${cache.max-age:60m}") Duration maxAge,
                          @Value("${cache.bar-count:300}") int barCount,
                          @Value("${market-data.fetch-timeout:60s}") Duration fetchTimeout) {
        this.provider     = provider;
        this.clock        = clock;
        this.timeframes   = timeframes.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        this.maxAge       = maxAge;
        this.barCount     = barCount;
        this.fetchTimeout = fetchTimeout;
    }

    @Override
    public Optional<TimeframeDataset> get(String timeframe) {
        return get(timeframe, false);
    }

    public Optional<TimeframeDataset> get(String timeframe, boolean forceRefresh) {
        ReentrantLock lock = lockFor(timeframe);
        lock.lock();
        try {
            Instant now = clock.instant();
            CacheEntry entry = store.get(timeframe);

            if (!forceRefresh && entry != null && entry.isValidAt(now, maxAge)) {
                log.debug("CACHE_HIT timeframe={} ageSeconds={}", timeframe, entry.ageAt(now).toSeconds());
                return Optional.of(entry.dataset());
            }

            log.info("CACHE_MISS timeframe={} reason={}", timeframe, missReason(entry, now, forceRefresh));
            CacheEntry fresh = fetch(timeframe);
            if (fresh != null) {
                return Optional.of(fresh.dataset());
            }
            return staleFallback(timeframe, entry, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces a refetch of every configured timeframe. Timeframes that fail keep their previous
     * entry and are listed in {@link CacheRefreshReport#failed()}.
     */
    public CacheRefreshReport refreshAll() {
        log.info("Refreshing all timeframes. timeframes={}", timeframes);
        List<String> refreshed = new ArrayList<>();
        List<String> failed    = new ArrayList<>();
        for (String timeframe : timeframes) {
            ReentrantLock lock = lockFor(timeframe);
            lock.lock();
            try {
                if (fetch(timeframe) != null) {
                    refreshed.add(timeframe);
                } else {
                    failed.add(timeframe);
                }
            } finally {
                lock.unlock();
            }
        }
        CacheRefreshReport report = new CacheRefreshReport(refreshed, failed, clock.instant());
        if (report.allSucceeded()) {
            log.info("All timeframes refreshed. count={}", refreshed.size());
        } else {
            log.warn("Timeframe refresh incomplete. refreshed={} failed={}", refreshed, failed);
        }
        return report;
    }

    /** Read-only snapshot per configured timeframe, in configuration order. */
    public Map<String, TimeframeCacheStatus> status() {
        Instant now = clock.instant();
        Map<String, TimeframeCacheStatus> status = new LinkedHashMap<>();
        for (String timeframe : timeframes) {
            CacheEntry entry = store.get(timeframe);
            if (entry == null) {
                status.put(timeframe, TimeframeCacheStatus.empty());
                continue;
            }
            double ageMinutes = entry.ageAt(now).toMillis() / 60_000.0;
            status.put(timeframe, new TimeframeCacheStatus(true, entry.fetchedAt(), ageMinutes,
                                                           entry.isValidAt(now, maxAge), entry.dataset().size()));
        }
        return status;
    }

    public List<String> timeframes() {
        return timeframes;
    }

    // ── internals ────────────────────────────────────────────────────────────

    /** Fetches and stores a new entry; {@code null} when the provider failed. Caller holds the lock. */
    private CacheEntry fetch(String timeframe) {
        TimeframeDataset dataset;
        try {
            dataset = provider.fetchTimeframe(timeframe, barCount).block(fetchTimeout);
        } catch (RuntimeException e) {
            log.warn("Fetch failed. timeframe={} error={}", timeframe, e.getMessage());
            return null;
        }
        if (dataset == null || dataset.isEmpty()) {
            log.warn("Fetch returned no bars. timeframe={}", timeframe);
            return null;
        }
        CacheEntry entry = new CacheEntry(dataset, clock.instant());
        store.put(timeframe, entry);
        log.info("CACHE_REFRESH timeframe={} bars={} fetchedAt={}", timeframe, dataset.size(), entry.fetchedAt());
        return entry;
    }

    private Optional<TimeframeDataset> staleFallback(String timeframe, CacheEntry entry, Instant now) {
        if (entry == null) {
            log.warn("No data available. timeframe={}", timeframe);
            return Optional.empty();
        }
        if (entry.isFutureDated(now)) {
            log.warn("Discarding future-dated entry. timeframe={} fetchedAt={} now={}",
                     timeframe, entry.fetchedAt(), now);
            return Optional.empty();
        }
        log.warn("CACHE_STALE_FALLBACK timeframe={} ageMinutes={}", timeframe, entry.ageAt(now).toMinutes());
        return Optional.of(entry.dataset());
    }

    private ReentrantLock lockFor(String timeframe) {
        return locks.computeIfAbsent(timeframe, k -> new ReentrantLock());
    }

    private String missReason(CacheEntry entry, Instant now, boolean forceRefresh) {
        if (forceRefresh) return "forced";
        if (entry == null) return "absent";
        if (entry.isFutureDated(now)) return "future-dated";
        return "expired";
    }
}
