package com.cycleindicators.common.exception;

public class IndicatorConfigurationException extends RuntimeException {

    public IndicatorConfigurationException(String message) {
        super(message);
    }

    public IndicatorConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
