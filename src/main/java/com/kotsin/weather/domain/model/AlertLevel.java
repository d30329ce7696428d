package com.kotsin.weather.domain.model;

/**
 * Alert level of a flagged point, derived from its fused severity.
 */
public enum AlertLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static AlertLevel fromSeverity(double severity) {
        if (severity >= 0.8) {
            return HIGH;
        }
        if (severity >= 0.5) {
            return MEDIUM;
        }
        return LOW;
    }
}
