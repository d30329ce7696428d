package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelVariant;

/**
 * A model fitted to one training window.
 */
public interface FittedModel {

    ModelVariant getVariant();

    /**
     * Forecast {@code horizon} days past the last training date.
     */
    ForecastResult predict(int horizon);

    /**
     * In-sample one-step-ahead predictions aligned with the training values;
     * {@code NaN} where the model has no prediction (e.g. before the first full lag window).
     */
    double[] fittedValues();
}
