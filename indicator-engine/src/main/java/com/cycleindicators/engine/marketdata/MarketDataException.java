package com.cycleindicators.engine.marketdata;

/**
 * The market-data source failed to deliver a usable dataset. {@code retryable} marks
 * transient conditions (rate-limit notes, 5xx answers) worth another attempt.
 */
public class MarketDataException extends RuntimeException {

    private final boolean retryable;

    public MarketDataException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = false;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
