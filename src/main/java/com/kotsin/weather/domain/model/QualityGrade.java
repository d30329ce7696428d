package com.kotsin.weather.domain.model;

/**
 * Coarse grade derived from the overall quality score.
 */
public enum QualityGrade {
    /**
     * Overall score of at least 0.9
     */
    HIGH,

    /**
     * Minor gaps or inconsistencies, fine for modelling
     */
    ACCEPTABLE,

    /**
     * Usable, but forecasts and flags deserve a second look
     */
    DEGRADED,

    /**
     * Below 0.5; results are reported with a warning
     */
    POOR;

    public static QualityGrade fromScore(double overall) {
        if (overall >= 0.9) {
            return HIGH;
        }
        if (overall >= 0.7) {
            return ACCEPTABLE;
        }
        if (overall >= 0.5) {
            return DEGRADED;
        }
        return POOR;
    }

    /**
     * Check if this grade is usable for modelling without a caveat
     */
    public boolean isUsableForModelling() {
        return this == HIGH || this == ACCEPTABLE;
    }
}
