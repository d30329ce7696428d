package com.kotsin.weather.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

/**
 * Forecast of one adapter or of the ensemble: {@code horizon} consecutive daily dates,
 * starting the day after the last input date.
 */
@Getter
@ToString
public final class ForecastResult {

    /**
     * Source label: a variant id, or {@code "ensemble"}
     */
    private final String source;
    private final List<ForecastPoint> points;

    public ForecastResult(String source, List<ForecastPoint> points) {
        this.source = source;
        this.points = List.copyOf(points);
        for (int i = 1; i < this.points.size(); i++) {
            LocalDate expected = this.points.get(i - 1).getDate().plusDays(1);
            if (!this.points.get(i).getDate().equals(expected)) {
                throw new IllegalArgumentException("Forecast dates must be contiguous; expected " + expected
                        + " but got " + this.points.get(i).getDate());
            }
        }
    }

    /**
     * Builds a result from parallel arrays of point estimates and interval half-widths.
     */
    public static ForecastResult fromHalfWidths(String source, LocalDate lastObserved, double[] point, double[] halfWidth) {
        ForecastPoint[] out = new ForecastPoint[point.length];
        for (int h = 0; h < point.length; h++) {
            double half = Math.max(0.0, halfWidth[h]);
            out[h] = new ForecastPoint(lastObserved.plusDays(h + 1L), point[h], point[h] - half, point[h] + half);
        }
        return new ForecastResult(source, List.of(out));
    }

    public int horizon() {
        return points.size();
    }

    public LocalDate firstDate() {
        return points.isEmpty() ? null : points.get(0).getDate();
    }

    public double[] pointEstimates() {
        return points.stream().mapToDouble(ForecastPoint::getPoint).toArray();
    }

    public double meanIntervalWidth() {
        return points.stream().mapToDouble(ForecastPoint::width).average().orElse(0.0);
    }
}
