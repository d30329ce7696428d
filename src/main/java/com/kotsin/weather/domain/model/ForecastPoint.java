package com.kotsin.weather.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * One forecast date. Invariant: {@code lower <= point <= upper}.
 */
@Value
public class ForecastPoint {
    LocalDate date;
    double point;
    double lower;
    double upper;

    public ForecastPoint(LocalDate date, double point, double lower, double upper) {
        if (!(lower <= point && point <= upper)) {
            throw new IllegalArgumentException(String.format(
                    "Interval does not contain point at %s: %.6f <= %.6f <= %.6f", date, lower, point, upper));
        }
        this.date = date;
        this.point = point;
        this.lower = lower;
        this.upper = upper;
    }

    public double width() {
        return upper - lower;
    }
}
