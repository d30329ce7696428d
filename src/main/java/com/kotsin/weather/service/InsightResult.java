package com.kotsin.weather.service;

import com.kotsin.weather.anomaly.AnomalyReport;
import com.kotsin.weather.domain.model.Diagnostic;
import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.QualityReport;
import com.kotsin.weather.domain.model.ValidationMetric;
import com.kotsin.weather.forecast.EnsembleForecast;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Best-effort result of a request: the ensemble forecast, the anomaly report, and the diagnostics of every
 * model or detector that did not contribute.
 */
@Value
@Builder
public class InsightResult {
    String requestId;
    String seriesId;
    String variable;
    QualityReport quality;
    EnsembleForecast ensemble;
    /**
     * Per-model forecasts of the surviving models; empty when not requested
     */
    Map<ModelVariant, ForecastResult> adapterForecasts;
    /**
     * Validation metrics with their ensemble weights, best first
     */
    List<ValidationMetric> rankedMetrics;
    ModelVariant bestModel;
    AnomalyReport anomalies;
    List<Diagnostic> diagnostics;

    public boolean isLowConfidence() {
        return ensemble != null && ensemble.isLowConfidence();
    }

    public ForecastResult getForecast() {
        return ensemble == null ? null : ensemble.getForecast();
    }
}
