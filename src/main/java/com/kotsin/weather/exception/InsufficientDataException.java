package com.kotsin.weather.exception;

import com.kotsin.weather.domain.model.ModelVariant;
import lombok.Getter;

/**
 * Series too short for the configured seasonality or model.
 * The variant is null when the check happens before any model is involved.
 */
@Getter
public class InsufficientDataException extends WeatherInsightException {

    private static final String DEFAULT_ERROR_CODE = "ERR-DATA-001";

    private final ModelVariant variant;
    private final int available;
    private final int required;

    public InsufficientDataException(String message, int available, int required) {
        this(null, message, available, required);
    }

    public InsufficientDataException(ModelVariant variant, String message, int available, int required) {
        super(message);
        this.variant = variant;
        this.available = available;
        this.required = required;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
