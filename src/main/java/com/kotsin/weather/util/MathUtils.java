package com.kotsin.weather.util;

import java.util.Arrays;

/**
 * MathUtils - NaN-aware statistics and safe arithmetic shared by the quality, forecast and anomaly code.
 *
 * Conventions:
 * - Array statistics ignore NaN entries (missing observations)
 * - Sample statistics use the n-1 denominator
 * - Empty input yields NaN, never an exception
 *
 * USAGE:
 * Instead of: double z = (x - mean) / std;
 * Use: double z = MathUtils.safeZScore(x, mean, std, 0.0);
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    // Epsilon for floating point comparisons
    public static final double EPSILON = 1e-10;

    /**
     * Scale factor turning a median absolute deviation into a normal-consistent sigma
     */
    public static final double MAD_TO_SIGMA = 1.4826;

    // ======================== SAFE DIVISION ========================

    /**
     * Safe division that returns defaultValue if denominator is 0, NaN, or Infinity
     */
    public static double safeDivide(double numerator, double denominator, double defaultValue) {
        if (!isValidDenominator(denominator)) {
            return defaultValue;
        }
        double result = numerator / denominator;
        return isValidNumber(result) ? result : defaultValue;
    }

    public static boolean isValidDenominator(double value) {
        return Math.abs(value) > EPSILON && isValidNumber(value);
    }

    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    /**
     * Safe z-score: returns defaultValue if stddev is 0
     */
    public static double safeZScore(double value, double mean, double stddev, double defaultValue) {
        return safeDivide(value - mean, stddev, defaultValue);
    }

    // ======================== CLAMPING ========================

    /**
     * Clamp value to range [min, max]; NaN maps to min
     */
    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static double clampUnit(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static boolean equals(double a, double b, double epsilon) {
        return Math.abs(a - b) < epsilon;
    }

    // ======================== ARRAY STATISTICS ========================

    /**
     * Finite values of the array, in order
     */
    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    public static int countFinite(double[] values) {
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                n++;
            }
        }
        return n;
    }

    public static double mean(double[] values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    public static double variance(double[] values) {
        double m = mean(values);
        double ss = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                ss += (v - m) * (v - m);
                n++;
            }
        }
        return n < 2 ? (n == 1 ? 0.0 : Double.NaN) : ss / (n - 1);
    }

    public static double std(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Quantile with linear interpolation between order statistics, q in [0, 1]
     */
    public static double quantile(double[] values, double q) {
        double[] sorted = finite(values);
        if (sorted.length == 0) {
            return Double.NaN;
        }
        Arrays.sort(sorted);
        return sortedQuantile(sorted, q);
    }

    public static double sortedQuantile(double[] sorted, double q) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double pos = clampUnit(q) * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = pos - lo;
        return sorted[lo] + frac * (sorted[hi] - sorted[lo]);
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    /**
     * Median absolute deviation around the median (unscaled)
     */
    public static double mad(double[] values) {
        double med = median(values);
        if (Double.isNaN(med)) {
            return Double.NaN;
        }
        double[] dev = finite(values);
        for (int i = 0; i < dev.length; i++) {
            dev[i] = Math.abs(dev[i] - med);
        }
        return median(dev);
    }

    public static double meanAbsolute(double[] values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                sum += Math.abs(v);
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    public static double rootMeanSquare(double[] values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                sum += v * v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : Math.sqrt(sum / n);
    }

    /**
     * Lag-1 autocorrelation of the finite values
     */
    public static double lagOneAutocorrelation(double[] values) {
        double[] x = finite(values);
        if (x.length < 3) {
            return 0.0;
        }
        double m = mean(x);
        double num = 0;
        double den = 0;
        for (int i = 0; i < x.length; i++) {
            den += (x[i] - m) * (x[i] - m);
            if (i > 0) {
                num += (x[i] - m) * (x[i - 1] - m);
            }
        }
        return safeDivide(num, den, 0.0);
    }

    /**
     * Standardize finite values to zero mean, unit variance; NaN stays NaN and a flat series maps to zeros
     */
    public static double[] standardize(double[] values) {
        double m = mean(values);
        double s = std(values);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Double.isFinite(values[i]) ? safeDivide(values[i] - m, s, 0.0) : Double.NaN;
        }
        return out;
    }
}
