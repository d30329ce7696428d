package com.kotsin.weather.domain.model;

/**
 * How a run of missing values was treated.
 */
public enum ImputationMethod {
    LINEAR_INTERPOLATION,
    SEASONAL_MEAN,
    LEFT_MISSING
}
