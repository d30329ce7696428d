package com.kotsin.weather.anomaly;

import com.kotsin.weather.domain.model.DetectorType;

/**
 * AnomalyDetector - one independent scoring method of the anomaly suite.
 *
 * Implementations are stateless singletons; everything rolling lives in the {@link DetectorState}
 * handed in for the (series, variable) being scored.
 */
public interface AnomalyDetector {

    DetectorType getType();

    /**
     * Score every point of the input.
     *
     * @return raw statistics with the cutoff above which a point counts as anomalous for this detector
     */
    DetectorScores score(DetectorInput input, AnomalyConfig config, DetectorState state);
}
