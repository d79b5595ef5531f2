package com.cycleindicators.common.model;

import java.time.Instant;

/**
 * One price bar. Timestamp marks the start of the bar's period.
 */
public record OhlcvBar(
    Instant timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {}
