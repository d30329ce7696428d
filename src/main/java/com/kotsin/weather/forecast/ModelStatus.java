package com.kotsin.weather.forecast;

/**
 * Terminal state of one adapter in a forecast run.
 */
public enum ModelStatus {
    SUCCEEDED,
    FIT_FAILED,
    INSUFFICIENT_DATA,
    TIMED_OUT,
    REJECTED
}
