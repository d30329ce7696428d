package com.kotsin.weather.forecast.model;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.forecast.FittedModel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.time.LocalDate;

/**
 * AutoregressiveModel - ARIMA-style AR(p) on the (seasonally) differenced series.
 *
 * The differenced series w is regressed on its own lags with an intercept. When no {@code order} is
 * configured, p is chosen by AIC up to {@code max_order}. Seasonal differencing at the largest configured
 * period is applied only when the series holds at least three full cycles of it.
 *
 * Forecasts run on the original scale through the expanded lag polynomial
 * (1 - phi(B)) (1 - B)^d (1 - B^s); interval variance comes from its psi-weights.
 *
 * Hyperparameters: order (AIC), max_order (7), d (1), seasonal_differencing (1)
 */
@Slf4j
public class AutoregressiveModel extends AbstractForecastModel {

    private static final int ABSOLUTE_MINIMUM = 8;
    private static final int SEASONAL_CYCLES = 3;

    public AutoregressiveModel() {
        super(ModelVariant.AUTOREGRESSIVE);
    }

    @Override
    public int minimumPoints(ModelConfig config) {
        int order = Math.max(1, config.hyperInt("order", 1));
        int d = differencingOrder(config);
        return Math.max(ABSOLUTE_MINIMUM, 2 * order + d + 2);
    }

    private static int differencingOrder(ModelConfig config) {
        return Math.max(0, Math.min(2, config.hyperInt("d", 1)));
    }

    /**
     * Largest configured period with at least three cycles in the data, or 0
     */
    static int seasonalLag(ModelConfig config, int n) {
        if (!config.hyperFlag("seasonal_differencing", true)) {
            return 0;
        }
        int lag = 0;
        for (int p : config.getSeasonalPeriods()) {
            if (p >= 2 && n >= SEASONAL_CYCLES * p) {
                lag = Math.max(lag, p);
            }
        }
        return lag;
    }

    @Override
    protected FittedModel fitValues(double[] y, LocalDate[] dates, ModelConfig config) {
        int n = y.length;
        int d = differencingOrder(config);
        int s = seasonalLag(config, n);

        double[] w = y;
        for (int i = 0; i < d; i++) {
            w = difference(w, 1);
        }
        if (s > 0) {
            w = difference(w, s);
        }
        int m = w.length;
        int maxFeasible = Math.max(1, (m - 2) / 2);

        int order;
        if (config.getHyperparameters().containsKey("order")) {
            order = Math.max(1, Math.min(config.hyperInt("order", 1), maxFeasible));
        } else {
            int maxOrder = Math.max(1, Math.min(config.hyperInt("max_order", 7), maxFeasible));
            order = selectOrder(w, maxOrder);
        }

        OLSMultipleLinearRegression ols = regression(w, order, order);
        double[] params = ols.estimateRegressionParameters();
        double sigma2 = ols.estimateErrorVariance();
        double intercept = params[0];
        double[] phi = new double[order];
        System.arraycopy(params, 1, phi, 0, order);

        double[] lagPoly = expand(phi, d, s);
        double[] fitted = new double[n];
        for (int t = 0; t < n; t++) {
            if (t < lagPoly.length - 1) {
                fitted[t] = Double.NaN;
                continue;
            }
            double v = intercept;
            for (int j = 1; j < lagPoly.length; j++) {
                v += lagPoly[j] * y[t - j];
            }
            fitted[t] = v;
        }

        log.debug("[FORECAST] autoregressive fitted: n={} p={} d={} seasonalLag={} sigma={}",
                n, order, d, s, String.format("%.4f", Math.sqrt(sigma2)));
        return new Fitted(y, dates[n - 1], intercept, lagPoly, sigma2, fitted, confidence(config));
    }

    /**
     * AIC selection on a common estimation sample
     */
    private int selectOrder(double[] w, int maxOrder) {
        int best = 1;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int p = 1; p <= maxOrder; p++) {
            checkInterrupted();
            OLSMultipleLinearRegression ols = regression(w, p, maxOrder);
            int rows = w.length - maxOrder;
            double rss = ols.calculateResidualSumOfSquares();
            double aic = rows * Math.log(Math.max(rss / rows, 1e-300)) + 2.0 * (p + 1);
            if (aic < bestAic) {
                bestAic = aic;
                best = p;
            }
        }
        return best;
    }

    private static OLSMultipleLinearRegression regression(double[] w, int p, int start) {
        int rows = w.length - start;
        double[] target = new double[rows];
        double[][] lags = new double[rows][p];
        for (int r = 0; r < rows; r++) {
            int t = start + r;
            target[r] = w[t];
            for (int i = 0; i < p; i++) {
                lags[r][i] = w[t - 1 - i];
            }
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(target, lags);
        return ols;
    }

    static double[] difference(double[] x, int lag) {
        double[] out = new double[Math.max(0, x.length - lag)];
        for (int t = lag; t < x.length; t++) {
            out[t - lag] = x[t] - x[t - lag];
        }
        return out;
    }

    /**
     * Coefficients a_j of y_t = c + sum a_j y_(t-j) for the combined AR and differencing polynomial;
     * index 0 is unused
     */
    static double[] expand(double[] phi, int d, int s) {
        double[] poly = new double[phi.length + 1];
        poly[0] = 1.0;
        for (int i = 0; i < phi.length; i++) {
            poly[i + 1] = -phi[i];
        }
        for (int i = 0; i < d; i++) {
            poly = multiply(poly, 1);
        }
        if (s > 0) {
            poly = multiply(poly, s);
        }
        double[] a = new double[poly.length];
        for (int j = 1; j < poly.length; j++) {
            a[j] = -poly[j];
        }
        return a;
    }

    /**
     * poly * (1 - B^lag)
     */
    private static double[] multiply(double[] poly, int lag) {
        double[] out = new double[poly.length + lag];
        for (int j = 0; j < poly.length; j++) {
            out[j] += poly[j];
            out[j + lag] -= poly[j];
        }
        return out;
    }

    private final class Fitted implements FittedModel {
        private final double[] history;
        private final LocalDate lastDate;
        private final double intercept;
        private final double[] lagPoly;
        private final double sigma2;
        private final double[] fitted;
        private final double confidence;

        private Fitted(double[] history, LocalDate lastDate, double intercept, double[] lagPoly, double sigma2,
                       double[] fitted, double confidence) {
            this.history = history.clone();
            this.lastDate = lastDate;
            this.intercept = intercept;
            this.lagPoly = lagPoly;
            this.sigma2 = sigma2;
            this.fitted = fitted;
            this.confidence = confidence;
        }

        @Override
        public ModelVariant getVariant() {
            return ModelVariant.AUTOREGRESSIVE;
        }

        @Override
        public ForecastResult predict(int horizon) {
            int n = history.length;
            int order = lagPoly.length - 1;
            double[] extended = new double[n + horizon];
            System.arraycopy(history, 0, extended, 0, n);
            double[] point = new double[horizon];
            for (int h = 0; h < horizon; h++) {
                int t = n + h;
                double v = intercept;
                for (int j = 1; j <= order; j++) {
                    v += lagPoly[j] * extended[t - j];
                }
                extended[t] = v;
                point[h] = v;
            }

            double[] psi = new double[horizon];
            double[] variance = new double[horizon];
            double cumulative = 0;
            for (int k = 0; k < horizon; k++) {
                if (k == 0) {
                    psi[k] = 1.0;
                } else {
                    double v = 0;
                    for (int j = 1; j <= Math.min(k, order); j++) {
                        v += lagPoly[j] * psi[k - j];
                    }
                    psi[k] = v;
                }
                cumulative += psi[k] * psi[k];
                variance[k] = sigma2 * cumulative;
            }
            return toResult(lastDate, point, variance, confidence);
        }

        @Override
        public double[] fittedValues() {
            return fitted.clone();
        }
    }
}
