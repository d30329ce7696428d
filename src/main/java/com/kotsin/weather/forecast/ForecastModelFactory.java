package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.forecast.model.AutoregressiveModel;
import com.kotsin.weather.forecast.model.SeasonalDecompositionModel;
import com.kotsin.weather.forecast.model.SequenceLearningModel;
import com.kotsin.weather.forecast.model.TrendHolidayModel;
import org.springframework.stereotype.Component;

/**
 * Maps each variant of the closed model set to its implementation.
 */
@Component
public class ForecastModelFactory {

    public ForecastModel create(ModelVariant variant) {
        return switch (variant) {
            case SEASONAL_DECOMPOSITION -> new SeasonalDecompositionModel();
            case TREND_HOLIDAY -> new TrendHolidayModel();
            case AUTOREGRESSIVE -> new AutoregressiveModel();
            case SEQUENCE_LEARNING -> new SequenceLearningModel();
        };
    }

    public int minimumPoints(ModelConfig config) {
        return create(config.getVariant()).minimumPoints(config);
    }
}
