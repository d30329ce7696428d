package com.kotsin.weather.forecast.model;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.forecast.FittedModel;
import com.kotsin.weather.util.MathUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;

/**
 * SeasonalDecompositionModel - trend plus trigonometric seasonality for several periods at once.
 *
 * The series is regressed on [1, t, Fourier terms of every seasonal period]; the trend can be damped
 * when extrapolated and the residuals can carry AR(1) errors.
 *
 * Hyperparameters:
 * - harmonics (3): Fourier pairs per period
 * - use_damped_trend (1), damping (0.98)
 * - use_arma_errors (1)
 */
@Slf4j
public class SeasonalDecompositionModel extends AbstractForecastModel {

    private static final double RIDGE = 1e-8;
    private static final double MAX_ERROR_AR = 0.95;

    public SeasonalDecompositionModel() {
        super(ModelVariant.SEASONAL_DECOMPOSITION);
    }

    @Override
    public int minimumPoints(ModelConfig config) {
        return Math.max(2 * config.maxSeasonalPeriod(), 8);
    }

    @Override
    protected FittedModel fitValues(double[] y, LocalDate[] dates, ModelConfig config) {
        int n = y.length;
        FourierTerms fourier = new FourierTerms(config.getSeasonalPeriods(), config.hyperInt("harmonics", 3));
        int k = 2 + fourier.width();
        long origin = dates[0].toEpochDay();
        double scale = n;

        double[][] x = new double[n][k];
        for (int i = 0; i < n; i++) {
            long day = dates[i].toEpochDay();
            x[i][0] = 1.0;
            x[i][1] = (day - origin) / scale;
            fourier.fill(day, x[i], 2);
        }
        double[] penalty = LeastSquares.uniform(k, RIDGE);
        penalty[0] = 0.0;
        LeastSquares.Solution fit = LeastSquares.solve(x, y, penalty);

        double phi = config.hyperFlag("use_arma_errors", true)
                ? MathUtils.clamp(MathUtils.lagOneAutocorrelation(fit.residuals), -MAX_ERROR_AR, MAX_ERROR_AR)
                : 0.0;
        double damping = config.hyperFlag("use_damped_trend", true)
                ? MathUtils.clamp(config.hyper("damping", 0.98), 0.0, 1.0)
                : 1.0;

        double[] fitted = new double[n];
        double ss = 0;
        for (int i = 0; i < n; i++) {
            fitted[i] = fit.fitted[i] + (i > 0 ? phi * fit.residuals[i - 1] : 0.0);
            double innovation = y[i] - fitted[i];
            ss += innovation * innovation;
        }
        double sigma2 = ss / Math.max(1, n - k - 1);

        log.debug("[FORECAST] seasonal-decomposition fitted: n={} columns={} errorAr={} damping={} sigma={}",
                n, k, String.format("%.3f", phi), damping, String.format("%.4f", Math.sqrt(sigma2)));
        return new Fitted(fit.coefficients, fourier, origin, scale, dates[n - 1], fit.residuals[n - 1],
                phi, damping, sigma2, fitted, confidence(config));
    }

    private final class Fitted implements FittedModel {
        private final double[] beta;
        private final FourierTerms fourier;
        private final long origin;
        private final double scale;
        private final LocalDate lastDate;
        private final double lastResidual;
        private final double phi;
        private final double damping;
        private final double sigma2;
        private final double[] fitted;
        private final double confidence;

        private Fitted(double[] beta, FourierTerms fourier, long origin, double scale, LocalDate lastDate,
                       double lastResidual, double phi, double damping, double sigma2, double[] fitted,
                       double confidence) {
            this.beta = beta;
            this.fourier = fourier;
            this.origin = origin;
            this.scale = scale;
            this.lastDate = lastDate;
            this.lastResidual = lastResidual;
            this.phi = phi;
            this.damping = damping;
            this.sigma2 = sigma2;
            this.fitted = fitted;
            this.confidence = confidence;
        }

        @Override
        public ModelVariant getVariant() {
            return ModelVariant.SEASONAL_DECOMPOSITION;
        }

        @Override
        public ForecastResult predict(int horizon) {
            double[] point = new double[horizon];
            double[] variance = new double[horizon];
            double[] row = new double[beta.length];
            long lastDay = lastDate.toEpochDay();
            double dampedSteps = 0;
            double dampingPower = 1;
            double errorPower = 1;
            double psiSum = 0;
            for (int h = 1; h <= horizon; h++) {
                dampingPower *= damping;
                dampedSteps += dampingPower;
                long day = lastDay + h;
                row[0] = 1.0;
                row[1] = (lastDay - origin + dampedSteps) / scale;
                fourier.fill(day, row, 2);
                double value = 0;
                for (int j = 0; j < beta.length; j++) {
                    value += beta[j] * row[j];
                }
                psiSum += errorPower * errorPower;
                errorPower *= phi;
                point[h - 1] = value + errorPower * lastResidual;
                variance[h - 1] = sigma2 * psiSum;
            }
            return toResult(lastDate, point, variance, confidence);
        }

        @Override
        public double[] fittedValues() {
            return fitted.clone();
        }
    }
}
