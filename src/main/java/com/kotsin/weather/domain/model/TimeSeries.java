package com.kotsin.weather.domain.model;

import lombok.Getter;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Immutable, date-indexed daily series of named weather variables.
 *
 * Dates are strictly increasing and unique. Every point carries every variable; gaps in the
 * observations are explicit {@code null} values so calendar alignment is preserved. The core never
 * mutates a caller's series: all cleaning and imputation produce new instances via
 * {@link #withValues(String, double[])}.
 */
@Getter
public final class TimeSeries {

    private final String seriesId;
    private final List<SeriesPoint> points;
    private final List<String> variables;

    private TimeSeries(String seriesId, List<SeriesPoint> points) {
        this.seriesId = Objects.requireNonNull(seriesId, "seriesId");
        TreeSet<String> names = new TreeSet<>();
        for (SeriesPoint p : points) {
            names.addAll(p.getValues().keySet());
        }
        this.variables = List.copyOf(names);

        List<SeriesPoint> aligned = new ArrayList<>(points.size());
        LocalDate previous = null;
        for (SeriesPoint p : points) {
            if (previous != null && !p.getDate().isAfter(previous)) {
                throw new IllegalArgumentException(String.format(
                        "Series %s: dates must be strictly increasing (%s after %s)", seriesId, p.getDate(), previous));
            }
            previous = p.getDate();
            aligned.add(p.getValues().keySet().containsAll(names) ? p : align(p, names));
        }
        this.points = Collections.unmodifiableList(aligned);
    }

    private static SeriesPoint align(SeriesPoint p, TreeSet<String> names) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String name : names) {
            values.put(name, p.get(name));
        }
        return new SeriesPoint(p.getDate(), values);
    }

    public static TimeSeries of(String seriesId, List<SeriesPoint> points) {
        return new TimeSeries(seriesId, points == null ? List.of() : points);
    }

    /**
     * Single-variable daily series starting at {@code start}; {@code NaN} entries become missing values.
     */
    public static TimeSeries daily(String seriesId, String variable, LocalDate start, double[] values) {
        List<SeriesPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            Double v = Double.isNaN(values[i]) ? null : values[i];
            points.add(SeriesPoint.of(start.plusDays(i), variable, v));
        }
        return new TimeSeries(seriesId, points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public boolean hasVariable(String variable) {
        return variables.contains(variable);
    }

    public LocalDate firstDate() {
        return points.isEmpty() ? null : points.get(0).getDate();
    }

    public LocalDate lastDate() {
        return points.isEmpty() ? null : points.get(points.size() - 1).getDate();
    }

    public LocalDate dateAt(int index) {
        return points.get(index).getDate();
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(points.size());
        for (SeriesPoint p : points) {
            dates.add(p.getDate());
        }
        return dates;
    }

    /**
     * Values of one variable in date order; missing or non-finite observations are {@code NaN}.
     */
    public double[] values(String variable) {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = points.get(i).get(variable);
            out[i] = (v == null || !Double.isFinite(v)) ? Double.NaN : v;
        }
        return out;
    }

    public int missingCount(String variable) {
        int missing = 0;
        for (SeriesPoint p : points) {
            if (p.isMissing(variable)) {
                missing++;
            }
        }
        return missing;
    }

    /**
     * First {@code length} points, same identity. Used for rolling-origin training windows.
     */
    public TimeSeries head(int length) {
        if (length >= points.size()) {
            return this;
        }
        return new TimeSeries(seriesId, points.subList(0, Math.max(0, length)));
    }

    /**
     * Working copy with one variable replaced; {@code NaN} entries stay missing.
     */
    public TimeSeries withValues(String variable, double[] replacement) {
        if (replacement.length != points.size()) {
            throw new IllegalArgumentException(String.format(
                    "Replacement for %s has %d values, series has %d points", variable, replacement.length, points.size()));
        }
        List<SeriesPoint> copy = new ArrayList<>(points.size());
        for (int i = 0; i < replacement.length; i++) {
            SeriesPoint p = points.get(i);
            Map<String, Double> values = new LinkedHashMap<>(p.getValues());
            values.put(variable, Double.isNaN(replacement[i]) ? null : replacement[i]);
            copy.add(new SeriesPoint(p.getDate(), values));
        }
        return new TimeSeries(seriesId, copy);
    }

    /**
     * MD5 over dates and values. Two series with the same content hash are interchangeable inputs.
     */
    public String contentHash() {
        StringBuilder sb = new StringBuilder(points.size() * 24);
        sb.append(String.join(",", variables));
        for (SeriesPoint p : points) {
            sb.append('|').append(p.getDate());
            for (String variable : variables) {
                Double v = p.get(variable);
                sb.append(';');
                if (v != null) {
                    sb.append(v);
                }
            }
        }
        return DigestUtils.md5DigestAsHex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return String.format("TimeSeries[%s, %d points, %s..%s, variables=%s]",
                seriesId, points.size(), firstDate(), lastDate(), variables);
    }
}
