package com.cycleindicators.common.model;

/**
 * Success accounting for one composite run. {@code successRate} is a percentage in [0, 100]
 * computed over {@code countedIndicators}, which equals {@code totalIndicators} unless the
 * configured policy excludes zero-weight failures from the denominator.
 */
public record DataQuality(
    int totalIndicators,
    int successfulCalculations,
    int failedCalculations,
    int countedIndicators,
    double successRate
) {}
