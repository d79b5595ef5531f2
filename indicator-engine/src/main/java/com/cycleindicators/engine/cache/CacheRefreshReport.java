package com.cycleindicators.engine.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Which configured timeframes a forced refresh actually replaced. */
public record CacheRefreshReport(
    List<String> refreshed,
    List<String> failed,
    Instant completedAt
) {
    public CacheRefreshReport {
        refreshed = List.copyOf(refreshed);
        failed    = List.copyOf(failed);
    }

    @JsonProperty("allSucceeded")
    public boolean allSucceeded() {
        return failed.isEmpty();
    }
}
