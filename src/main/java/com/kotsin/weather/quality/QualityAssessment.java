package com.kotsin.weather.quality;

import com.kotsin.weather.domain.model.QualityReport;
import com.kotsin.weather.domain.model.TimeSeries;
import lombok.Value;

/**
 * Output of the quality assessor.
 *
 * {@code cleaned} keeps gaps that exceeded the imputation limit as missing values;
 * {@code modelInput} additionally fills them forward/backward so every model sees a complete series.
 */
@Value
public class QualityAssessment {
    QualityReport report;
    TimeSeries cleaned;
    TimeSeries modelInput;
}
