package com.kotsin.weather.anomaly;

/**
 * Maps a raw detector statistic to [0, 1] relative to the detector's own cutoff.
 *
 * r = raw / cutoff, normalized = r^2 / (1 + r^2): 0 for a perfectly typical point, 0.5 exactly at the cutoff,
 * approaching 1 for extreme points.
 */
public final class ScoreNormalizer {

    private ScoreNormalizer() {}

    public static double normalize(double raw, double cutoff) {
        if (Double.isNaN(raw)) {
            return Double.NaN;
        }
        if (Double.isInfinite(raw)) {
            return 1.0;
        }
        double r = Math.max(0.0, raw) / cutoff;
        return r * r / (1.0 + r * r);
    }

    /**
     * A detector contributes to a flag when its statistic exceeds its cutoff
     */
    public static boolean exceeds(double raw, double cutoff) {
        return !Double.isNaN(raw) && raw > cutoff;
    }
}
