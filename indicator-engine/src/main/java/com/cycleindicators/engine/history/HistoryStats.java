package com.cycleindicators.engine.history;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryStats(
    int totalRuns,
    int successfulRuns,
    int failedRuns,
    int indicatorRows,
    Instant oldestRun,
    Instant newestRun
) {}
