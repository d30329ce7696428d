package com.kotsin.weather.forecast.model;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.exception.ModelFitException;
import com.kotsin.weather.forecast.FittedModel;
import com.kotsin.weather.forecast.ForecastModel;
import com.kotsin.weather.forecast.PredictionIntervals;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;

import java.time.LocalDate;

/**
 * AbstractForecastModel - common input checks and result assembly for the forecast variants.
 *
 * <h2>Subclass Contract</h2>
 * <ol>
 *   <li>{@link #minimumPoints(ModelConfig)} states the data requirement</li>
 *   <li>{@link #fitValues(double[], LocalDate[], ModelConfig)} fits a complete value array</li>
 * </ol>
 */
public abstract class AbstractForecastModel implements ForecastModel {

    private final ModelVariant variant;

    protected AbstractForecastModel(ModelVariant variant) {
        this.variant = variant;
    }

    @Override
    public ModelVariant getVariant() {
        return variant;
    }

    @Override
    public final FittedModel fit(TimeSeries series, String variable, ModelConfig config) {
        if (!series.hasVariable(variable)) {
            throw new ModelFitException(variant, "Series " + series.getSeriesId() + " has no variable " + variable);
        }
        int required = minimumPoints(config);
        if (series.size() < required) {
            throw new InsufficientDataException(variant, String.format(
                    "[%s] needs at least %d points for seasonal periods %s, got %d",
                    variant.getId(), required, config.getSeasonalPeriods(), series.size()),
                    series.size(), required);
        }
        double[] values = series.values(variable);
        for (double v : values) {
            if (Double.isNaN(v)) {
                throw new ModelFitException(variant, "Series contains missing values in " + variable);
            }
        }
        LocalDate[] dates = series.dates().toArray(new LocalDate[0]);
        try {
            return fitValues(values, dates, config);
        } catch (ArithmeticException | MathIllegalArgumentException | MathIllegalStateException e) {
            throw new ModelFitException(variant, "Numerical failure: " + e.getMessage(), e);
        }
    }

    /**
     * Fit a complete value array. {@code dates} are the matching calendar days.
     */
    protected abstract FittedModel fitValues(double[] values, LocalDate[] dates, ModelConfig config);

    protected static double confidence(ModelConfig config) {
        return config.hyper(PredictionIntervals.CONFIDENCE_LEVEL, PredictionIntervals.DEFAULT_CONFIDENCE);
    }

    /**
     * Assemble a forecast from point estimates and per-step error variances
     */
    protected ForecastResult toResult(LocalDate lastDate, double[] point, double[] variance, double confidence) {
        for (int h = 0; h < point.length; h++) {
            if (!Double.isFinite(point[h]) || !Double.isFinite(variance[h])) {
                throw new ModelFitException(variant, "Non-finite forecast at step " + (h + 1));
            }
        }
        return ForecastResult.fromHalfWidths(variant.getId(), lastDate, point,
                PredictionIntervals.halfWidths(variance, confidence));
    }

    /**
     * Throws when the fitting thread was interrupted, e.g. by a timeout
     */
    protected void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ModelFitException(variant, "Fit interrupted");
        }
    }
}
