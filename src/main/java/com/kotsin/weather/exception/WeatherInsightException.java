package com.kotsin.weather.exception;

import lombok.Getter;

/**
 * Base exception for the forecasting and anomaly core.
 * Every failure carries an error code so callers can map it without parsing messages.
 */
@Getter
public abstract class WeatherInsightException extends RuntimeException {

    private final String errorCode;

    protected WeatherInsightException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected WeatherInsightException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected WeatherInsightException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
