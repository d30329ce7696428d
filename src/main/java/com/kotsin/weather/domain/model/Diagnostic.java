package com.kotsin.weather.domain.model;

import lombok.Value;

/**
 * Record of a contained failure: which sub-model or detector did not contribute and why.
 */
@Value
public class Diagnostic {
    /**
     * e.g. {@code model:autoregressive}, {@code detector:isolation}, {@code quality}
     */
    String component;
    DiagnosticStatus status;
    String errorCode;
    String message;

    public static Diagnostic model(ModelVariant variant, DiagnosticStatus status, String errorCode, String message) {
        return new Diagnostic("model:" + variant.getId(), status, errorCode, message);
    }

    public static Diagnostic detector(DetectorType type, String errorCode, String message) {
        return new Diagnostic("detector:" + type.getId(), DiagnosticStatus.DETECTOR_FAILED, errorCode, message);
    }

    public static Diagnostic warning(String component, String message) {
        return new Diagnostic(component, DiagnosticStatus.WARNING, null, message);
    }
}
