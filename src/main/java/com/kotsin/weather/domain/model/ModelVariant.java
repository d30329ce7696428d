package com.kotsin.weather.domain.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of forecasting algorithm families. Adding an algorithm means adding a constant here
 * and a case in the model factory.
 */
@Getter
public enum ModelVariant {

    SEASONAL_DECOMPOSITION("seasonal-decomposition"),
    TREND_HOLIDAY("trend-holiday"),
    AUTOREGRESSIVE("autoregressive"),
    SEQUENCE_LEARNING("sequence-learning");

    private final String id;

    ModelVariant(String id) {
        this.id = id;
    }

    /**
     * Resolve from the identifier or the enum name, case-insensitively.
     */
    public static ModelVariant fromId(String id) {
        String key = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.id.equals(key) || v.name().toLowerCase(Locale.ROOT).equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown model variant: " + id));
    }
}
