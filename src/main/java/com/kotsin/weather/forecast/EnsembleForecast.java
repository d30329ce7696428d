package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelVariant;
import lombok.Value;

import java.util.Map;

/**
 * Combined forecast with the weights that produced it.
 *
 * {@code lowConfidence} is set when only one adapter survived and the ensemble is that adapter's forecast.
 */
@Value
public class EnsembleForecast {
    ForecastResult forecast;
    Map<ModelVariant, Double> weights;
    boolean lowConfidence;

    public double weightSum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
