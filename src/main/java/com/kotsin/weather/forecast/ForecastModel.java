package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.exception.ModelFitException;

/**
 * ForecastModel - uniform contract of the forecasting algorithm families.
 *
 * Each variant is stateless; all fitted state lives in the returned {@link FittedModel}, so one
 * instance may be fitted concurrently on different training windows.
 */
public interface ForecastModel {

    /**
     * Get the algorithm family of this model.
     */
    ModelVariant getVariant();

    /**
     * Minimum number of points this model needs under the given configuration.
     */
    int minimumPoints(ModelConfig config);

    /**
     * Fit the model to one variable of a complete (gap-free) series.
     *
     * @param series   cleaned series, no missing values in {@code variable}
     * @param variable variable to model
     * @param config   configuration of this adapter
     * @return fitted model ready to predict past the last date of {@code series}
     * @throws InsufficientDataException when the series is shorter than {@link #minimumPoints}
     * @throws ModelFitException         on numerical failure
     */
    FittedModel fit(TimeSeries series, String variable, ModelConfig config);
}
