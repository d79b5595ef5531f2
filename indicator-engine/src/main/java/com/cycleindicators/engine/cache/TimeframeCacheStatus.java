package com.cycleindicators.engine.cache;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeframeCacheStatus(
    boolean cached,
    Instant lastUpdate,
    Double ageMinutes,
    boolean valid,
    Integer bars
) {
    public static TimeframeCacheStatus empty() {
        return new TimeframeCacheStatus(false, null, null, false, null);
    }
}
