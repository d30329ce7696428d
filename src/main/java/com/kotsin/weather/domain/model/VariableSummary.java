package com.kotsin.weather.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Descriptive statistics of one variable over the observed (non-missing) values.
 */
@Value
@Builder
public class VariableSummary {
    String variable;
    int count;
    int missing;
    double mean;
    double std;
    double min;
    double max;
    double median;
    int zeroCount;
    int negativeCount;
}
