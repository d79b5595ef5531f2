package com.cycleindicators.engine.service;

import com.cycleindicators.common.model.CompositeResult;
import com.cycleindicators.engine.cache.TimeframeCacheStatus;
import com.cycleindicators.engine.context.MarketContext;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Everything one coordinator run produced. A run that failed at the top boundary carries
 * only {@code runId}, {@code calculationInfo} and {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisRun(
    String runId,
    CalculationInfo calculationInfo,
    CompositeResult bottomIndicators,
    CompositeResult topIndicators,
    MarketContext marketContext,
    Map<String, TimeframeCacheStatus> cacheStatus,
    String error
) {

    public static AnalysisRun failed(String runId, CalculationInfo info, String error) {
        return new AnalysisRun(runId, info, null, null, null, null, error);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null;
    }
}
