package com.kotsin.weather.service;

import com.kotsin.weather.domain.model.TimeSeries;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One forecast + anomaly request.
 *
 * Any option left null or empty falls back to the {@code weather.insight} properties.
 */
@Value
@Builder(toBuilder = true)
public class InsightRequest {

    TimeSeries series;

    /**
     * Variable to forecast
     */
    String variable;

    /**
     * Model ids, e.g. {@code seasonal-decomposition}, {@code autoregressive}
     */
    @Singular
    List<String> models;

    Integer horizon;
    Set<Integer> seasonalPeriods;
    Set<LocalDate> holidayCalendar;

    /**
     * Hyperparameters per model id
     */
    @Singular
    Map<String, Map<String, Double>> hyperparameters;

    Integer cvFolds;

    /**
     * Enabled detector ids; empty enables all seven
     */
    @Singular
    List<String> detectors;

    @Singular
    Map<String, Double> detectorWeights;

    Double dynamicThresholdZ;
    Double perModelTimeoutSeconds;
    Integer maxSeriesLengthForSequenceModel;

    /**
     * Variables scanned for anomalies; empty scans every variable of the series
     */
    @Singular
    List<String> anomalyVariables;

    /**
     * Reference date for timeliness scoring
     */
    LocalDate asOf;

    @Builder.Default
    boolean includeAdapterForecasts = true;

    /**
     * How long a cached result of this request may be served; null uses the configured default
     */
    Duration cacheExpiry;
}
