package com.kotsin.weather.exception;

import lombok.Getter;

import java.util.List;

/**
 * Malformed model, detector or request configuration. Raised before any fitting begins.
 */
@Getter
public class InvalidConfigException extends WeatherInsightException {

    private static final String DEFAULT_ERROR_CODE = "ERR-CFG-001";

    private final List<String> violations;

    public InvalidConfigException(String message) {
        this(List.of(message));
    }

    public InvalidConfigException(List<String> violations) {
        super("Invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
