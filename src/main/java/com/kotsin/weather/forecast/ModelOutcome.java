package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.Diagnostic;
import com.kotsin.weather.domain.model.DiagnosticStatus;
import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.ValidationMetric;
import lombok.Value;
import lombok.With;

/**
 * Result of one adapter task: forecast and validation on success, a diagnostic otherwise.
 */
@Value
public class ModelOutcome {
    ModelVariant variant;
    ModelStatus status;
    ForecastResult forecast;
    @With
    ValidationMetric metric;
    /**
     * In-sample errors of the full fit; null when the fit has no finite fitted values
     */
    ValidationMetric inSampleMetric;
    Diagnostic diagnostic;
    long elapsedMs;

    public static ModelOutcome succeeded(ModelVariant variant, ForecastResult forecast, ValidationMetric metric,
                                         ValidationMetric inSampleMetric, long elapsedMs) {
        return new ModelOutcome(variant, ModelStatus.SUCCEEDED, forecast, metric, inSampleMetric, null, elapsedMs);
    }

    public static ModelOutcome failed(ModelVariant variant, ModelStatus status, String errorCode, String message,
                                      long elapsedMs) {
        DiagnosticStatus diagnosticStatus = switch (status) {
            case INSUFFICIENT_DATA -> DiagnosticStatus.INSUFFICIENT_DATA;
            case TIMED_OUT -> DiagnosticStatus.TIMED_OUT;
            case REJECTED -> DiagnosticStatus.REJECTED;
            default -> DiagnosticStatus.FIT_FAILED;
        };
        return new ModelOutcome(variant, status, null, null, null,
                Diagnostic.model(variant, diagnosticStatus, errorCode, message), elapsedMs);
    }

    public boolean isSucceeded() {
        return status == ModelStatus.SUCCEEDED;
    }
}
