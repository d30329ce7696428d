package com.kotsin.weather.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * A point whose fused severity exceeded the dynamic threshold of its variable.
 */
@Value
@Builder
public class AnomalyFlag {
    LocalDate date;
    String variable;
    double value;
    double severity;
    List<DetectorType> contributors;
    double threshold;
    AlertLevel level;
}
