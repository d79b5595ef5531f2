package com.cycleindicators.common.model;

/**
 * Human-readable reading of a composite score.
 * {@code percentage} is the score × 100 rounded to one decimal place.
 */
public record Interpretation(
    SignalStrength strength,
    String description,
    String color,
    double score,
    double percentage
) {}
