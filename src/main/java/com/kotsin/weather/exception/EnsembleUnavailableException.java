package com.kotsin.weather.exception;

/**
 * No forecasting adapter survived fitting and validation.
 */
public class EnsembleUnavailableException extends WeatherInsightException {

    private static final String DEFAULT_ERROR_CODE = "ERR-ENS-001";

    public EnsembleUnavailableException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
