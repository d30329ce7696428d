package com.kotsin.weather.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One calendar day of observations. A missing observation is an explicit {@code null} entry,
 * never an absent key, so every point of a series carries the same variable set.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SeriesPoint {

    private final LocalDate date;
    private final Map<String, Double> values;

    public SeriesPoint(LocalDate date, Map<String, Double> values) {
        this.date = Objects.requireNonNull(date, "date");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values == null ? Map.of() : values));
    }

    public static SeriesPoint of(LocalDate date, String variable, Double value) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(variable, value);
        return new SeriesPoint(date, values);
    }

    /**
     * Value of a variable, or {@code null} when missing.
     */
    public Double get(String variable) {
        return values.get(variable);
    }

    public boolean isMissing(String variable) {
        Double v = values.get(variable);
        return v == null || !Double.isFinite(v);
    }
}
