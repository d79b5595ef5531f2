package com.cycleindicators.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one side's composite score for one run.
 *
 * <p>Three shapes exist:
 * <ul>
 *   <li><b>scored</b>: {@code compositeScore}, statistics and interpretation present;</li>
 *   <li><b>no valid indicators</b>: {@code compositeScore == null}, {@code totalWeight == 0},
 *       {@code error == }{@value #NO_VALID_INDICATORS}, indicator partitions still present;</li>
 *   <li><b>composer error</b>: only {@code side}, {@code error} and {@code timestamp}.</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompositeResult(
    Side side,
    Double compositeScore,
    Double totalWeight,
    List<IndicatorResult> validIndicators,
    List<IndicatorResult> failedIndicators,
    ScoreStatistics scoreStatistics,
    Interpretation interpretation,
    DataQuality dataQuality,
    Instant timestamp,
    String error
) {

    public static final String NO_VALID_INDICATORS = "No valid indicators";

    public CompositeResult {
        validIndicators  = validIndicators == null ? null : List.copyOf(validIndicators);
        failedIndicators = failedIndicators == null ? null : List.copyOf(failedIndicators);
    }

    public static CompositeResult error(Side side, String error, Instant timestamp) {
        return new CompositeResult(side, null, null, null, null, null, null, null, timestamp, error);
    }

    @JsonIgnore
    public boolean isScored() {
        return compositeScore != null;
    }

    @JsonIgnore
    public boolean hasNoValidIndicators() {
        return NO_VALID_INDICATORS.equals(error);
    }

    @JsonProperty("failedIndicatorNames")
    public List<String> failedIndicatorNames() {
        if (failedIndicators == null) return List.of();
        return failedIndicators.stream().map(IndicatorResult::name).toList();
    }

    @JsonIgnore
    public int validCount() {
        return validIndicators == null ? 0 : validIndicators.size();
    }

    /** Valid results followed by failed results. */
    @JsonIgnore
    public List<IndicatorResult> allIndicators() {
        if (validIndicators == null && failedIndicators == null) return List.of();
        List<IndicatorResult> all = new ArrayList<>();
        if (validIndicators != null) all.addAll(validIndicators);
        if (failedIndicators != null) all.addAll(failedIndicators);
        return List.copyOf(all);
    }
}
