package com.kotsin.weather.anomaly.impl;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.anomaly.AnomalyDetector;
import com.kotsin.weather.anomaly.DetectorInput;
import com.kotsin.weather.anomaly.DetectorScores;
import com.kotsin.weather.anomaly.DetectorState;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.util.MathUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Classical additive decomposition: centered moving-average trend, per-phase seasonal means of the
 * detrended series, residual = value - trend - seasonal. Residuals are scored against their median in
 * robust (MAD) standard deviations.
 */
@Component
public class SeasonalResidualDetector implements AnomalyDetector {

    @Override
    public DetectorType getType() {
        return DetectorType.SEASONAL_RESIDUAL;
    }

    @Override
    public DetectorScores score(DetectorInput input, AnomalyConfig config, DetectorState state) {
        int period = Math.max(2, config.getSeasonalPeriod());
        double[] x = input.getValues();
        int n = x.length;
        if (n < 2 * period) {
            throw new InsufficientDataException(String.format(
                    "Seasonal decomposition with period %d needs %d points, got %d", period, 2 * period, n),
                    n, 2 * period);
        }

        double[] trend = centeredMovingAverage(x, period);
        long[] phase = phases(input.getDates(), period);

        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int t = 0; t < n; t++) {
            int p = (int) phase[t];
            phaseSum[p] += x[t] - trend[t];
            phaseCount[p]++;
        }
        double[] seasonal = new double[period];
        double seasonalMean = 0;
        for (int p = 0; p < period; p++) {
            seasonal[p] = phaseCount[p] == 0 ? 0.0 : phaseSum[p] / phaseCount[p];
            seasonalMean += seasonal[p];
        }
        seasonalMean /= period;

        double[] residual = new double[n];
        for (int t = 0; t < n; t++) {
            residual[t] = x[t] - trend[t] - (seasonal[(int) phase[t]] - seasonalMean);
        }

        double median = MathUtils.median(residual);
        double scale = MathUtils.MAD_TO_SIGMA * MathUtils.mad(residual);
        if (!MathUtils.isValidDenominator(scale)) {
            scale = MathUtils.std(residual);
        }
        double[] raw = new double[n];
        for (int t = 0; t < n; t++) {
            raw[t] = TrailingWindowSupport.ratio(residual[t] - median, scale);
        }
        return new DetectorScores(getType(), raw, config.getSeasonalResidualThreshold());
    }

    /**
     * Centered moving average (2 x p for even p); the ends repeat the nearest full-window value.
     */
    static double[] centeredMovingAverage(double[] x, int period) {
        int n = x.length;
        double[] trend = new double[n];
        int half = period / 2;
        boolean even = period % 2 == 0;
        int first = half;
        int last = n - 1 - half;
        for (int t = first; t <= last; t++) {
            double sum = 0;
            if (even) {
                sum += 0.5 * x[t - half] + 0.5 * x[t + half];
                for (int k = t - half + 1; k < t + half; k++) {
                    sum += x[k];
                }
            } else {
                for (int k = t - half; k <= t + half; k++) {
                    sum += x[k];
                }
            }
            trend[t] = sum / period;
        }
        for (int t = 0; t < first; t++) {
            trend[t] = trend[first];
        }
        for (int t = last + 1; t < n; t++) {
            trend[t] = trend[last];
        }
        return trend;
    }

    private static long[] phases(List<LocalDate> dates, int period) {
        long[] phase = new long[dates.size()];
        for (int t = 0; t < phase.length; t++) {
            phase[t] = Math.floorMod(dates.get(t).toEpochDay(), period);
        }
        return phase;
    }
}
