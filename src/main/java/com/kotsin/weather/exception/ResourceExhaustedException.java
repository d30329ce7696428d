package com.kotsin.weather.exception;

import lombok.Getter;

/**
 * Rejected by the memory governor before the work started.
 */
@Getter
public class ResourceExhaustedException extends WeatherInsightException {

    private static final String DEFAULT_ERROR_CODE = "ERR-RES-001";

    private final long requestedBytes;
    private final long availableBytes;

    public ResourceExhaustedException(String message, long requestedBytes, long availableBytes) {
        super(message);
        this.requestedBytes = requestedBytes;
        this.availableBytes = availableBytes;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
