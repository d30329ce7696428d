package com.kotsin.weather.forecast.model;

import java.util.Collection;

/**
 * Sine/cosine regressors for a set of seasonal periods.
 */
final class FourierTerms {

    private final int[] periods;
    private final int[] harmonics;

    /**
     * @param periods     seasonal periods, those below 3 are skipped
     * @param maxHarmonic requested harmonics per period, capped at (p - 1) / 2 so no column is degenerate
     */
    FourierTerms(Collection<Integer> periods, int maxHarmonic) {
        this.periods = periods.stream().filter(p -> p >= 3).mapToInt(Integer::intValue).toArray();
        this.harmonics = new int[this.periods.length];
        for (int i = 0; i < this.periods.length; i++) {
            this.harmonics[i] = Math.max(1, Math.min(maxHarmonic, (this.periods[i] - 1) / 2));
        }
    }

    int width() {
        int w = 0;
        for (int k : harmonics) {
            w += 2 * k;
        }
        return w;
    }

    /**
     * Write the terms for time index {@code t} into {@code row} starting at {@code offset}
     */
    void fill(long t, double[] row, int offset) {
        int c = offset;
        for (int i = 0; i < periods.length; i++) {
            for (int k = 1; k <= harmonics[i]; k++) {
                double angle = 2.0 * Math.PI * k * t / periods[i];
                row[c++] = Math.sin(angle);
                row[c++] = Math.cos(angle);
            }
        }
    }
}
