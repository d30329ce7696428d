package com.kotsin.weather.forecast;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Gaussian prediction interval helpers.
 */
public final class PredictionIntervals {

    public static final String CONFIDENCE_LEVEL = "confidence_level";
    public static final double DEFAULT_CONFIDENCE = 0.95;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private PredictionIntervals() {}

    /**
     * Two-sided critical value, e.g. 1.96 for 0.95
     */
    public static double z(double confidence) {
        double c = Math.min(0.999999, Math.max(0.5, confidence));
        return STANDARD_NORMAL.inverseCumulativeProbability(0.5 + c / 2.0);
    }

    /**
     * Half-widths for a horizon given the forecast-error variance per step
     */
    public static double[] halfWidths(double[] variance, double confidence) {
        double z = z(confidence);
        double[] out = new double[variance.length];
        for (int h = 0; h < variance.length; h++) {
            out[h] = z * Math.sqrt(Math.max(0.0, variance[h]));
        }
        return out;
    }
}
