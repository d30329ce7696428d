package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.exception.ModelFitException;
import com.kotsin.weather.forecast.model.AutoregressiveModel;

/**
 * Adapters with controlled timing and failures, all backed by a real autoregressive fit.
 */
final class ForecastModelStubs {

    private ForecastModelStubs() {
    }

    /**
     * Sleeps before every fit (full fit and each fold), then fits normally.
     */
    static ForecastModel sleeping(ModelVariant variant, long sleepMs) {
        AutoregressiveModel delegate = new AutoregressiveModel();
        return new ForecastModel() {
            @Override
            public ModelVariant getVariant() {
                return variant;
            }

            @Override
            public int minimumPoints(ModelConfig config) {
                return delegate.minimumPoints(config);
            }

            @Override
            public FittedModel fit(TimeSeries series, String variable, ModelConfig config) {
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ModelFitException(variant, "Fit interrupted");
                }
                return delegate.fit(series, variable, config);
            }
        };
    }

    /**
     * Fits only a series of at least {@code fullLength} points, so every rolling-origin fold fails.
     */
    static ForecastModel failingOnFolds(ModelVariant variant, int fullLength) {
        AutoregressiveModel delegate = new AutoregressiveModel();
        return new ForecastModel() {
            @Override
            public ModelVariant getVariant() {
                return variant;
            }

            @Override
            public int minimumPoints(ModelConfig config) {
                return delegate.minimumPoints(config);
            }

            @Override
            public FittedModel fit(TimeSeries series, String variable, ModelConfig config) {
                if (series.size() < fullLength) {
                    throw new ModelFitException(variant, "Training window of " + series.size() + " points rejected");
                }
                return delegate.fit(series, variable, config);
            }
        };
    }
}
