package com.kotsin.weather.quality;

import com.kotsin.weather.domain.model.GapTreatment;
import com.kotsin.weather.domain.model.ImputationMethod;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * MissingValueImputer - fills runs of missing observations according to their length.
 *
 * Policy per gap:
 * - length <= maxLinearGap with observations on both sides: linear interpolation
 * - length <= maxGap: seasonal mean of same-phase observations at t +/- k*p for the largest usable
 *   period p, shifted to the level of the gap edges; linear interpolation when no period is usable
 * - longer gaps, or gaps that cannot be bridged: left missing
 */
@Slf4j
public class MissingValueImputer {

    private final int maxLinearGap;
    private final int maxGap;

    public MissingValueImputer(int maxLinearGap, int maxGap) {
        this.maxLinearGap = Math.max(0, maxLinearGap);
        this.maxGap = Math.max(this.maxLinearGap, maxGap);
    }

    @Value
    public static class Imputation {
        double[] values;
        List<GapTreatment> treatments;
    }

    /**
     * Impute one variable. The input array is not modified.
     */
    public Imputation impute(String variable, List<LocalDate> dates, double[] values, Collection<Integer> periods) {
        double[] out = values.clone();
        List<GapTreatment> treatments = new ArrayList<>();
        NavigableSet<Integer> candidates = new TreeSet<>(periods);

        int i = 0;
        while (i < values.length) {
            if (!Double.isNaN(values[i])) {
                i++;
                continue;
            }
            int start = i;
            while (i < values.length && Double.isNaN(values[i])) {
                i++;
            }
            int end = i - 1;
            int length = end - start + 1;
            boolean bounded = start > 0 && end < values.length - 1;

            ImputationMethod method = ImputationMethod.LEFT_MISSING;
            int usedPeriod = 0;
            if (length <= maxLinearGap && bounded) {
                interpolate(out, start, end);
                method = ImputationMethod.LINEAR_INTERPOLATION;
            } else if (length <= maxGap) {
                usedPeriod = seasonalFill(values, out, start, end, candidates);
                if (usedPeriod > 0) {
                    method = ImputationMethod.SEASONAL_MEAN;
                } else if (bounded) {
                    interpolate(out, start, end);
                    method = ImputationMethod.LINEAR_INTERPOLATION;
                }
            }
            treatments.add(new GapTreatment(variable, dates.get(start), dates.get(end), length, method, usedPeriod));
        }

        if (!treatments.isEmpty()) {
            log.debug("[QUALITY] {}: {} gaps treated", variable, treatments.size());
        }
        return new Imputation(out, treatments);
    }

    private static void interpolate(double[] out, int start, int end) {
        double left = out[start - 1];
        double right = out[end + 1];
        int span = end - start + 2;
        for (int t = start; t <= end; t++) {
            double frac = (double) (t - start + 1) / span;
            out[t] = left + frac * (right - left);
        }
    }

    /**
     * Seasonal substitution from the original observations; returns the period used, or 0 when none fits.
     */
    private static int seasonalFill(double[] original, double[] out, int start, int end, NavigableSet<Integer> periods) {
        for (Integer p : periods.descendingSet()) {
            if (p < 2 || p >= original.length) {
                continue;
            }
            double[] estimate = new double[end - start + 1];
            boolean feasible = true;
            for (int t = start; t <= end && feasible; t++) {
                estimate[t - start] = phaseMean(original, t, p);
                feasible = !Double.isNaN(estimate[t - start]);
            }
            if (!feasible) {
                continue;
            }
            double offset = edgeOffset(original, start, end, p);
            for (int t = start; t <= end; t++) {
                out[t] = estimate[t - start] + offset;
            }
            return p;
        }
        return 0;
    }

    /**
     * Mean of observed values at the same phase, t +/- k*p, excluding t itself
     */
    static double phaseMean(double[] values, int t, int p) {
        double sum = 0;
        int n = 0;
        for (int s = t - p; s >= 0; s -= p) {
            if (!Double.isNaN(values[s])) {
                sum += values[s];
                n++;
            }
        }
        for (int s = t + p; s < values.length; s += p) {
            if (!Double.isNaN(values[s])) {
                sum += values[s];
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /**
     * Average difference between the observed gap edges and their seasonal estimates
     */
    private static double edgeOffset(double[] values, int start, int end, int p) {
        double sum = 0;
        int n = 0;
        if (start > 0) {
            double est = phaseMean(values, start - 1, p);
            if (!Double.isNaN(est)) {
                sum += values[start - 1] - est;
                n++;
            }
        }
        if (end < values.length - 1) {
            double est = phaseMean(values, end + 1, p);
            if (!Double.isNaN(est)) {
                sum += values[end + 1] - est;
                n++;
            }
        }
        return n == 0 ? 0.0 : sum / n;
    }

    /**
     * Forward fill, then backward fill for a leading run. Used for the modelling copy only.
     */
    public static double[] fillRemaining(double[] values) {
        double[] out = values.clone();
        double last = Double.NaN;
        for (int t = 0; t < out.length; t++) {
            if (Double.isNaN(out[t])) {
                out[t] = last;
            } else {
                last = out[t];
            }
        }
        double next = Double.NaN;
        for (int t = out.length - 1; t >= 0; t--) {
            if (Double.isNaN(out[t])) {
                out[t] = next;
            } else {
                next = out[t];
            }
        }
        return out;
    }
}
