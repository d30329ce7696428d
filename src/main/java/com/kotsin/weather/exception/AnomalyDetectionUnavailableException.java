package com.kotsin.weather.exception;

/**
 * Every enabled detector failed, so no fused severity can be produced.
 */
public class AnomalyDetectionUnavailableException extends WeatherInsightException {

    private static final String DEFAULT_ERROR_CODE = "ERR-ANM-001";

    public AnomalyDetectionUnavailableException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
