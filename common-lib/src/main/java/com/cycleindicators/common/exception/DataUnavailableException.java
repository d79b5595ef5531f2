package com.cycleindicators.common.exception;

/**
 * The dataset an indicator needs is missing, too short for its lookback window,
 * or lacks a required derived series.
 */
public class DataUnavailableException extends IndicatorException {

    public DataUnavailableException(String indicatorName, String message) {
        super(indicatorName, message);
    }
}
