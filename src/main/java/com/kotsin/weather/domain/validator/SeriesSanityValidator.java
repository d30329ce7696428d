package com.kotsin.weather.domain.validator;

import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.util.MathUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * SeriesSanityValidator - Centralized plausibility checks for weather series
 *
 * Provides validation checks for:
 * - Physical ranges of known variables
 * - Calendar continuity (daily spacing)
 * - Day-over-day jumps
 *
 * Usage:
 *   List<String> violations = SeriesSanityValidator.validate(series);
 *   if (!violations.isEmpty()) {
 *       log.warn("Validation found issues: {}", violations);
 *   }
 */
@Slf4j
public final class SeriesSanityValidator {

    private SeriesSanityValidator() {}

    /**
     * Plausible physical range of a known variable: {min, max}
     */
    private static final Map<String, double[]> PHYSICAL_RANGES = Map.of(
            "temperature", new double[]{-90.0, 60.0},
            "precipitation", new double[]{0.0, 2000.0},
            "humidity", new double[]{0.0, 100.0},
            "pressure", new double[]{850.0, 1100.0},
            "wind_speed", new double[]{0.0, 120.0},
            "cloud_cover", new double[]{0.0, 100.0}
    );

    // ==================== RANGE VALIDATION ====================

    /**
     * Range of a variable, matched on the variable name prefix (e.g. {@code temperature_max} uses
     * the temperature range). Null when the variable is unknown.
     */
    public static double[] physicalRange(String variable) {
        String key = variable.toLowerCase(Locale.ROOT).replace('-', '_');
        for (Map.Entry<String, double[]> e : PHYSICAL_RANGES.entrySet()) {
            if (key.startsWith(e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }

    /**
     * Whether an observed value is plausible. Unknown variables only need to be finite.
     */
    public static boolean isPlausible(String variable, double value) {
        if (!Double.isFinite(value)) {
            return false;
        }
        double[] range = physicalRange(variable);
        return range == null || (value >= range[0] && value <= range[1]);
    }

    /**
     * Count observed values outside the plausible range of the variable
     */
    public static int countImplausible(String variable, double[] values) {
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v) && !isPlausible(variable, v)) {
                count++;
            }
        }
        return count;
    }

    // ==================== CALENDAR VALIDATION ====================

    /**
     * Number of consecutive date pairs more than one day apart
     */
    public static int countCalendarGaps(TimeSeries series) {
        int gaps = 0;
        for (int i = 1; i < series.size(); i++) {
            if (ChronoUnit.DAYS.between(series.dateAt(i - 1), series.dateAt(i)) > 1) {
                gaps++;
            }
        }
        return gaps;
    }

    /**
     * Number of day-over-day changes larger than {@code factor} robust standard deviations of all changes.
     * Pairs involving a missing value are skipped.
     */
    public static int countImplausibleJumps(double[] values, double factor) {
        List<Double> diffs = new ArrayList<>();
        for (int i = 1; i < values.length; i++) {
            if (Double.isFinite(values[i]) && Double.isFinite(values[i - 1])) {
                diffs.add(values[i] - values[i - 1]);
            }
        }
        if (diffs.size() < 3) {
            return 0;
        }
        double[] d = diffs.stream().mapToDouble(Double::doubleValue).toArray();
        double[] abs = new double[d.length];
        double med = MathUtils.median(d);
        for (int i = 0; i < d.length; i++) {
            abs[i] = Math.abs(d[i] - med);
        }
        double scale = MathUtils.MAD_TO_SIGMA
                * MathUtils.median(abs);
        if (scale <= MathUtils.EPSILON) {
            return 0;
        }
        int jumps = 0;
        for (double v : abs) {
            if (v > factor * scale) {
                jumps++;
            }
        }
        return jumps;
    }

    // ==================== SERIES VALIDATION ====================

    /**
     * Validate a series and return the list of violations (empty when clean)
     */
    public static List<String> validate(TimeSeries series) {
        List<String> violations = new ArrayList<>();

        if (series == null) {
            violations.add("Series is null");
            return violations;
        }

        String id = series.getSeriesId();

        if (series.isEmpty()) {
            violations.add(String.format("%s: Series has no points", id));
            return violations;
        }
        if (series.getVariables().isEmpty()) {
            violations.add(String.format("%s: Series has no variables", id));
        }

        int gaps = countCalendarGaps(series);
        if (gaps > 0) {
            LocalDate first = series.firstDate();
            long span = ChronoUnit.DAYS.between(first, series.lastDate()) + 1;
            violations.add(String.format("%s: %d calendar gaps (%d points over %d days)", id, gaps, series.size(), span));
        }

        for (String variable : series.getVariables()) {
            double[] values = series.values(variable);
            int implausible = countImplausible(variable, values);
            if (implausible > 0) {
                violations.add(String.format("%s: %s has %d values outside its physical range", id, variable, implausible));
            }
            int missing = series.missingCount(variable);
            if (missing == values.length) {
                violations.add(String.format("%s: %s has no observed values", id, variable));
            }
        }

        return violations;
    }
}
