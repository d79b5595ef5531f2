package com.cycleindicators.engine.service;

import com.cycleindicators.engine.cache.CacheRefreshReport;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;

/** Timing and refresh metadata of one analysis run. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalculationInfo(
    Instant startTime,
    Instant endTime,
    double durationSeconds,
    boolean dataRefreshed,
    CacheRefreshReport refreshReport
) {

    public static CalculationInfo of(Instant start, Instant end, boolean dataRefreshed, CacheRefreshReport report) {
        return new CalculationInfo(start, end, Duration.between(start, end).toMillis() / 1000.0, dataRefreshed, report);
    }
}
