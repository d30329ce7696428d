package com.kotsin.weather.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable quality assessment of a series. All scores are in [0, 1];
 * {@code overall} is the weighted average of the four dimension scores.
 */
@Value
@Builder
public class QualityReport {
    String seriesId;
    double completeness;
    double consistency;
    double accuracy;
    double timeliness;
    double overall;
    QualityGrade grade;
    @Singular
    List<String> recommendations;
    @Singular
    List<GapTreatment> treatments;
    @Singular
    Map<String, VariableSummary> summaries;
}
