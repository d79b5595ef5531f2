package com.cycleindicators.common.exception;

/**
 * A single indicator's formula could not produce a value. Caught at indicator
 * granularity and recorded as the {@code error} of that indicator's result.
 */
public class IndicatorException extends RuntimeException {
    private final String indicatorName;

    public IndicatorException(String indicatorName, String message) {
        super("[" + indicatorName + "] " + message);
        this.indicatorName = indicatorName;
    }

    public IndicatorException(String indicatorName, String message, Throwable cause) {
        super("[" + indicatorName + "] " + message, cause);
        this.indicatorName = indicatorName;
    }

    public String getIndicatorName() {
        return indicatorName;
    }
}
