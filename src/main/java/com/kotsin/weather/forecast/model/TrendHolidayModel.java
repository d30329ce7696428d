package com.kotsin.weather.forecast.model;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.forecast.FittedModel;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;

/**
 * TrendHolidayModel - piecewise-linear trend with changepoints, additive seasonality and holiday effects.
 *
 * The trend g(t) = k + m*t + sum(delta_j * (t - c_j)+) bends at changepoints spread over the first part of
 * the history; the deltas are ridge-penalized so only supported bends survive. Holidays enter as
 * gamma * g(t) * H(t): the first stage estimates the trend, the second refits with the holiday regressor
 * built from it, so a holiday effect grows or shrinks with the local trend level.
 *
 * Hyperparameters:
 * - changepoints (10), changepoint_range (0.8), changepoint_penalty (10.0)
 * - harmonics (3)
 */
@Slf4j
public class TrendHolidayModel extends AbstractForecastModel {

    private static final double RIDGE = 1e-6;
    private static final int MIN_SEGMENT = 5;

    public TrendHolidayModel() {
        super(ModelVariant.TREND_HOLIDAY);
    }

    @Override
    public int minimumPoints(ModelConfig config) {
        return Math.max(2 * config.maxSeasonalPeriod(), 8);
    }

    @Override
    protected FittedModel fitValues(double[] y, LocalDate[] dates, ModelConfig config) {
        int n = y.length;
        long origin = dates[0].toEpochDay();
        double span = Math.max(1, dates[n - 1].toEpochDay() - origin);

        double range = Math.min(1.0, Math.max(0.0, config.hyper("changepoint_range", 0.8)));
        int requested = Math.max(0, config.hyperInt("changepoints", 10));
        int changepointCount = Math.min(requested, (int) (range * n) / MIN_SEGMENT);
        double[] changepoints = new double[changepointCount];
        for (int j = 0; j < changepointCount; j++) {
            changepoints[j] = range * (j + 1) / (changepointCount + 1);
        }

        FourierTerms fourier = new FourierTerms(config.getSeasonalPeriods(), config.hyperInt("harmonics", 3));
        double[] time = new double[n];
        for (int i = 0; i < n; i++) {
            time[i] = (dates[i].toEpochDay() - origin) / span;
        }

        // stage 1: trend + seasonality
        Layout layout = new Layout(changepointCount, fourier.width(), false);
        double[][] x = new double[n][layout.width];
        for (int i = 0; i < n; i++) {
            layout.fill(x[i], time[i], changepoints, fourier, dates[i].toEpochDay(), 0.0);
        }
        double changepointPenalty = Math.max(0.0, config.hyper("changepoint_penalty", 10.0));
        LeastSquares.Solution stage1 = LeastSquares.solve(x, y, layout.penalties(changepointPenalty));

        // stage 2: holiday regressor scaled by the stage-1 trend level
        boolean holidaysInHistory = false;
        double[] holiday = new double[n];
        for (int i = 0; i < n; i++) {
            if (config.isHoliday(dates[i])) {
                holiday[i] = layout.trend(stage1.coefficients, time[i], changepoints);
                holidaysInHistory |= holiday[i] != 0.0;
            }
        }
        double[] beta;
        double[] fitted;
        double sigma2;
        Layout finalLayout;
        double[] trendCoefficients;
        if (holidaysInHistory) {
            finalLayout = new Layout(changepointCount, fourier.width(), true);
            double[][] x2 = new double[n][finalLayout.width];
            for (int i = 0; i < n; i++) {
                finalLayout.fill(x2[i], time[i], changepoints, fourier, dates[i].toEpochDay(), holiday[i]);
            }
            LeastSquares.Solution stage2 = LeastSquares.solve(x2, y, finalLayout.penalties(changepointPenalty));
            beta = stage2.coefficients;
            fitted = stage2.fitted;
            sigma2 = stage2.residualVariance;
        } else {
            finalLayout = layout;
            beta = stage1.coefficients;
            fitted = stage1.fitted;
            sigma2 = stage1.residualVariance;
        }
        trendCoefficients = stage1.coefficients;

        // per-day slope uncertainty from the magnitude of the fitted changes
        double slopeVariance = 0;
        for (int j = 0; j < changepointCount; j++) {
            double perDay = beta[2 + j] / span;
            slopeVariance += perDay * perDay;
        }
        slopeVariance = changepointCount == 0 ? 0.0 : slopeVariance / n;

        log.debug("[FORECAST] trend-holiday fitted: n={} changepoints={} holidays={} sigma={}",
                n, changepointCount, holidaysInHistory, String.format("%.4f", Math.sqrt(sigma2)));
        return new Fitted(beta, trendCoefficients, finalLayout, layout, changepoints, fourier, origin, span,
                dates[n - 1], sigma2, slopeVariance, fitted, config);
    }

    /**
     * Column layout: [1, t, changepoint hinges..., Fourier..., holiday?]
     */
    private static final class Layout {
        private final int changepoints;
        private final int fourierWidth;
        private final boolean holiday;
        private final int width;

        private Layout(int changepoints, int fourierWidth, boolean holiday) {
            this.changepoints = changepoints;
            this.fourierWidth = fourierWidth;
            this.holiday = holiday;
            this.width = 2 + changepoints + fourierWidth + (holiday ? 1 : 0);
        }

        private void fill(double[] row, double t, double[] cps, FourierTerms fourier, long day, double holidayLevel) {
            row[0] = 1.0;
            row[1] = t;
            for (int j = 0; j < changepoints; j++) {
                row[2 + j] = Math.max(0.0, t - cps[j]);
            }
            fourier.fill(day, row, 2 + changepoints);
            if (holiday) {
                row[width - 1] = holidayLevel;
            }
        }

        private double trend(double[] beta, double t, double[] cps) {
            double g = beta[0] + beta[1] * t;
            for (int j = 0; j < changepoints; j++) {
                g += beta[2 + j] * Math.max(0.0, t - cps[j]);
            }
            return g;
        }

        private double[] penalties(double changepointPenalty) {
            double[] p = LeastSquares.uniform(width, RIDGE);
            p[0] = 0.0;
            for (int j = 0; j < changepoints; j++) {
                p[2 + j] = changepointPenalty;
            }
            return p;
        }
    }

    private final class Fitted implements FittedModel {
        private final double[] beta;
        private final double[] stage1;
        private final Layout layout;
        private final Layout stage1Layout;
        private final double[] changepoints;
        private final FourierTerms fourier;
        private final long origin;
        private final double span;
        private final LocalDate lastDate;
        private final double sigma2;
        private final double slopeVariance;
        private final double[] fitted;
        private final ModelConfig config;

        private Fitted(double[] beta, double[] stage1, Layout layout, Layout stage1Layout, double[] changepoints,
                       FourierTerms fourier, long origin, double span, LocalDate lastDate, double sigma2,
                       double slopeVariance, double[] fitted, ModelConfig config) {
            this.beta = beta;
            this.stage1 = stage1;
            this.layout = layout;
            this.stage1Layout = stage1Layout;
            this.changepoints = changepoints;
            this.fourier = fourier;
            this.origin = origin;
            this.span = span;
            this.lastDate = lastDate;
            this.sigma2 = sigma2;
            this.slopeVariance = slopeVariance;
            this.fitted = fitted;
            this.config = config;
        }

        @Override
        public ModelVariant getVariant() {
            return ModelVariant.TREND_HOLIDAY;
        }

        @Override
        public ForecastResult predict(int horizon) {
            double[] point = new double[horizon];
            double[] variance = new double[horizon];
            double[] row = new double[layout.width];
            for (int h = 1; h <= horizon; h++) {
                LocalDate date = lastDate.plusDays(h);
                double t = (date.toEpochDay() - origin) / span;
                double holidayLevel = config.isHoliday(date) ? stage1Layout.trend(stage1, t, changepoints) : 0.0;
                layout.fill(row, t, changepoints, fourier, date.toEpochDay(), holidayLevel);
                double value = 0;
                for (int j = 0; j < beta.length; j++) {
                    value += beta[j] * row[j];
                }
                point[h - 1] = value;
                variance[h - 1] = sigma2 + h * slopeVariance;
            }
            return toResult(lastDate, point, variance, confidence(config));
        }

        @Override
        public double[] fittedValues() {
            return fitted.clone();
        }
    }
}
