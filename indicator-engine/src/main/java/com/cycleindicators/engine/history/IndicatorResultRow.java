package com.cycleindicators.engine.history;

import com.cycleindicators.common.model.IndicatorResult;
import com.cycleindicators.common.model.Side;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndicatorResultRow(
    String runId,
    Side side,
    String name,
    Double rawValue,
    Double normalizedScore,
    double weight,
    boolean valid,
    Instant timestamp,
    String error
) {

    public static IndicatorResultRow of(String runId, IndicatorResult result) {
        return new IndicatorResultRow(runId, result.side(), result.name(), result.rawValue(),
                                      result.normalizedScore(), result.weight(), result.isValid(),
                                      result.timestamp(), result.error());
    }
}
