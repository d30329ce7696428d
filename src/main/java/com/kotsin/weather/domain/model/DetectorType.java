package com.kotsin.weather.domain.model;

import lombok.Getter;

/**
 * The seven anomaly detectors, in the order they are reported as contributors.
 */
@Getter
public enum DetectorType {

    IQR("iqr"),
    Z_SCORE("z-score"),
    MODIFIED_Z_SCORE("modified-z-score"),
    SEASONAL_RESIDUAL("seasonal-residual"),
    ISOLATION("isolation"),
    CLUSTERING_DISTANCE("clustering-distance"),
    CHANGE_POINT("change-point");

    private final String id;

    DetectorType(String id) {
        this.id = id;
    }
}
