package com.kotsin.weather.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * One entry of the missing-value treatment plan: a run of consecutive missing observations.
 */
@Value
public class GapTreatment {
    String variable;
    LocalDate start;
    LocalDate end;
    int length;
    ImputationMethod method;
    /**
     * Seasonal period used for {@link ImputationMethod#SEASONAL_MEAN}, 0 otherwise
     */
    int period;
}
