package com.kotsin.weather.exception;

import com.kotsin.weather.domain.model.ModelVariant;
import lombok.Getter;

/**
 * A forecasting adapter could not produce a usable fit (non-convergence, singular design,
 * non-finite coefficients, interruption).
 */
@Getter
public class ModelFitException extends WeatherInsightException {

    private static final String DEFAULT_ERROR_CODE = "ERR-FIT-001";

    private final ModelVariant variant;

    public ModelFitException(ModelVariant variant, String message) {
        super("[" + variant.getId() + "] " + message);
        this.variant = variant;
    }

    public ModelFitException(ModelVariant variant, String message, Throwable cause) {
        super("[" + variant.getId() + "] " + message, cause);
        this.variant = variant;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
