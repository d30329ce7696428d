package com.kotsin.weather.domain.model;

import com.kotsin.weather.exception.InvalidConfigException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-adapter configuration, validated at construction.
 *
 * Hyperparameters are numeric and read by name with a default, e.g. {@code order},
 * {@code harmonics}, {@code epochs}. Unknown names are ignored by the adapters.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ModelConfig {

    private final ModelVariant variant;
    private final SortedSet<Integer> seasonalPeriods;
    private final int horizon;
    private final SortedSet<LocalDate> holidayCalendar;
    private final Map<String, Double> hyperparameters;

    @Builder(toBuilder = true)
    private ModelConfig(ModelVariant variant, Set<Integer> seasonalPeriods, int horizon,
                        Set<LocalDate> holidayCalendar, Map<String, Double> hyperparameters) {
        List<String> violations = new ArrayList<>();
        if (variant == null) {
            violations.add("variant is required");
        }
        if (horizon <= 0) {
            violations.add("horizon must be positive, got " + horizon);
        }
        TreeSet<Integer> periods = new TreeSet<>();
        if (seasonalPeriods != null) {
            for (Integer p : seasonalPeriods) {
                if (p == null || p <= 0) {
                    violations.add("seasonal period must be positive, got " + p);
                } else {
                    periods.add(p);
                }
            }
        }
        TreeMap<String, Double> hyper = new TreeMap<>();
        if (hyperparameters != null) {
            hyperparameters.forEach((name, value) -> {
                if (value == null || !Double.isFinite(value)) {
                    violations.add("hyperparameter " + name + " must be a finite number");
                } else {
                    hyper.put(name, value);
                }
            });
        }
        if (!violations.isEmpty()) {
            throw new InvalidConfigException(violations);
        }
        this.variant = variant;
        this.horizon = horizon;
        this.seasonalPeriods = Collections.unmodifiableSortedSet(periods);
        this.holidayCalendar = Collections.unmodifiableSortedSet(
                holidayCalendar == null ? new TreeSet<>() : new TreeSet<>(holidayCalendar));
        this.hyperparameters = Collections.unmodifiableMap(hyper);
    }

    public int maxSeasonalPeriod() {
        return seasonalPeriods.isEmpty() ? 0 : seasonalPeriods.last();
    }

    public double hyper(String name, double defaultValue) {
        Double v = hyperparameters.get(name);
        return v == null ? defaultValue : v;
    }

    public int hyperInt(String name, int defaultValue) {
        Double v = hyperparameters.get(name);
        return v == null ? defaultValue : (int) Math.round(v);
    }

    public boolean hyperFlag(String name, boolean defaultValue) {
        Double v = hyperparameters.get(name);
        return v == null ? defaultValue : v != 0.0;
    }

    public boolean isHoliday(LocalDate date) {
        return holidayCalendar.contains(date);
    }
}
