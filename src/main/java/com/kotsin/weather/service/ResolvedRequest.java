package com.kotsin.weather.service;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.domain.model.ModelConfig;
import lombok.Value;

import java.util.List;

/**
 * A request with every default filled in. Also the configuration half of the cache key, so it holds
 * everything that changes the result and nothing that does not.
 */
@Value
public class ResolvedRequest {
    String seriesId;
    String variable;
    List<ModelConfig> models;
    int cvFolds;
    double perModelTimeoutSeconds;
    int maxSeriesLengthForSequenceModel;
    AnomalyConfig anomaly;
    List<String> anomalyVariables;
    String asOf;
    boolean includeAdapterForecasts;
}
