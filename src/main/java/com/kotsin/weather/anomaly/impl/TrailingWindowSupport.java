package com.kotsin.weather.anomaly.impl;

import com.kotsin.weather.util.MathUtils;

/**
 * Helpers shared by the trailing-window detectors.
 */
final class TrailingWindowSupport {

    /**
     * History needed before a trailing-window detector scores a point
     */
    static final int MIN_HISTORY = 10;

    /**
     * Raw score reported when the window has no spread but the point differs from it
     */
    static final double DEGENERATE_SCORE = 1e6;

    private TrailingWindowSupport() {}

    static int minHistory(int window) {
        return Math.max(3, Math.min(window, MIN_HISTORY));
    }

    /**
     * |deviation| / scale, with a flat window handled explicitly
     */
    static double ratio(double deviation, double scale) {
        double d = Math.abs(deviation);
        if (MathUtils.isValidDenominator(scale)) {
            return d / scale;
        }
        return d <= MathUtils.EPSILON ? 0.0 : DEGENERATE_SCORE;
    }
}
