package com.kotsin.weather.domain.model;

/**
 * Terminal state of a contained sub-task.
 */
public enum DiagnosticStatus {
    FIT_FAILED,
    INSUFFICIENT_DATA,
    TIMED_OUT,
    REJECTED,
    DETECTOR_FAILED,
    WARNING
}
