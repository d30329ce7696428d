package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.domain.model.ValidationMetric;
import com.kotsin.weather.exception.ModelFitException;
import com.kotsin.weather.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * CrossValidator - rolling-origin evaluation of one adapter.
 *
 * Fold k of K trains on the first n - (K - k) * h points and is scored on the next h actual values,
 * so every evaluation lies strictly after its training window. Folds whose training window is below
 * the model's minimum, or below the common minimum origin of the run, are skipped. Folds run in parallel
 * on the validation executor and share nothing. Failed folds are counted on the metric.
 *
 * When no fold fits inside the series, the metric falls back to in-sample one-step errors of the full fit
 * and is marked {@code inSample}.
 */
@Component
@Slf4j
public class CrossValidator {

    /**
     * Error ascending, then mean interval width ascending
     */
    public static final Comparator<ValidationMetric> RANKING = Comparator
            .comparingDouble(ValidationMetric::getMae)
            .thenComparingDouble(ValidationMetric::getMeanIntervalWidth);

    private final AsyncTaskExecutor validationExecutor;

    public CrossValidator(@Qualifier("validationExecutor") AsyncTaskExecutor validationExecutor) {
        this.validationExecutor = validationExecutor;
    }

    private static final class Fold {
        final double[] errors;
        final double width;

        Fold(double[] errors, double width) {
            this.errors = errors;
            this.width = width;
        }
    }

    /**
     * Validate one adapter.
     *
     * @param model    the adapter
     * @param series   complete modelling series
     * @param variable modelled variable
     * @param config   adapter configuration; its horizon is the fold length
     * @param folds    number of rolling origins
     * @param fullFit  fit on the whole series, used for the in-sample fallback
     * @param forecast forecast of the full fit, used for the in-sample interval width
     */
    public ValidationMetric validate(ForecastModel model, TimeSeries series, String variable, ModelConfig config,
                                     int folds, FittedModel fullFit, ForecastResult forecast) {
        return validate(model, series, variable, config, folds, 0, fullFit, forecast);
    }

    /**
     * Validate one adapter on fold origins no earlier than {@code minimumOrigin}. Adapters of one run share
     * the same minimum origin so that their errors are measured on the same evaluation windows.
     *
     * @param minimumOrigin smallest training length any fold of this run may use
     */
    public ValidationMetric validate(ForecastModel model, TimeSeries series, String variable, ModelConfig config,
                                     int folds, int minimumOrigin, FittedModel fullFit, ForecastResult forecast) {
        int n = series.size();
        int h = config.getHorizon();
        int minimum = Math.max(model.minimumPoints(config), minimumOrigin);
        double[] actual = series.values(variable);

        List<Future<Fold>> futures = new ArrayList<>();
        for (int k = 0; k < folds; k++) {
            int origin = n - (folds - k) * h;
            if (origin < minimum) {
                continue;
            }
            futures.add(validationExecutor.submit(() -> runFold(model, series.head(origin), variable, config,
                    actual, origin, h)));
        }

        List<Fold> completed = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                completed.add(futures.get(i).get());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new ModelFitException(model.getVariant(), "Validation interrupted");
            } catch (ExecutionException e) {
                failed++;
                log.warn("[CV] {} fold {}/{} failed: {}", model.getVariant().getId(), i + 1, futures.size(),
                        e.getCause().getMessage());
            }
        }

        if (completed.isEmpty()) {
            ValidationMetric metric = inSampleMetric(model, actual, fullFit, forecast);
            if (metric == null) {
                throw new ModelFitException(model.getVariant(), "No validation fold and no in-sample predictions");
            }
            log.debug("[CV] {}: no rolling-origin fold fits, using in-sample errors", model.getVariant().getId());
            return metric.toBuilder().failedFolds(failed).build();
        }

        List<Double> abs = new ArrayList<>();
        double squared = 0;
        double oneStep = 0;
        double width = 0;
        for (Fold fold : completed) {
            for (double e : fold.errors) {
                abs.add(Math.abs(e));
                squared += e * e;
            }
            oneStep += Math.abs(fold.errors[0]);
            width += fold.width;
        }
        double mae = abs.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
        ValidationMetric metric = ValidationMetric.builder()
                .variant(model.getVariant())
                .mae(mae)
                .rmse(Math.sqrt(squared / abs.size()))
                .oneStepMae(oneStep / completed.size())
                .meanIntervalWidth(width / completed.size())
                .folds(completed.size())
                .failedFolds(failed)
                .inSample(false)
                .build();
        log.debug("[CV] {}: folds={}/{} mae={} rmse={}", model.getVariant().getId(), completed.size(), folds,
                String.format("%.4f", metric.getMae()), String.format("%.4f", metric.getRmse()));
        return metric;
    }

    private static Fold runFold(ForecastModel model, TimeSeries training, String variable, ModelConfig config,
                                double[] actual, int origin, int h) {
        FittedModel fitted = model.fit(training, variable, config);
        ForecastResult forecast = fitted.predict(h);
        double[] point = forecast.pointEstimates();
        double[] errors = new double[h];
        for (int j = 0; j < h; j++) {
            errors[j] = actual[origin + j] - point[j];
        }
        return new Fold(errors, forecast.meanIntervalWidth());
    }

    /**
     * In-sample errors of the full fit, or null when the fit produced no finite fitted value.
     */
    public ValidationMetric inSampleMetric(ForecastModel model, double[] actual, FittedModel fullFit,
                                           ForecastResult forecast) {
        double[] fitted = fullFit.fittedValues();
        double[] errors = new double[actual.length];
        for (int t = 0; t < actual.length; t++) {
            errors[t] = actual[t] - fitted[t];
        }
        double mae = MathUtils.meanAbsolute(errors);
        if (Double.isNaN(mae)) {
            return null;
        }
        return ValidationMetric.builder()
                .variant(model.getVariant())
                .mae(mae)
                .rmse(MathUtils.rootMeanSquare(errors))
                .oneStepMae(mae)
                .meanIntervalWidth(forecast.meanIntervalWidth())
                .folds(0)
                .inSample(true)
                .build();
    }
}
