package com.kotsin.weather.anomaly;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Read-only input of one detector run.
 */
@Value
public class DetectorInput {
    String seriesId;
    String variable;
    List<LocalDate> dates;
    /**
     * Complete (gap-filled) values of the variable
     */
    double[] values;
    /**
     * True where the raw series had an actual observation; imputed points are never flagged
     */
    boolean[] observed;
    /**
     * Complete values of the other variables, for the multivariate detectors
     */
    Map<String, double[]> covariates;

    public int size() {
        return values.length;
    }
}
