package com.kotsin.weather.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Rolling-origin validation result of one adapter.
 *
 * {@code weight} is assigned by the ensemble combiner; weights across surviving adapters sum to one.
 */
@Value
@Builder(toBuilder = true)
public class ValidationMetric {
    ModelVariant variant;
    double mae;
    double rmse;
    double oneStepMae;
    double meanIntervalWidth;
    int folds;
    /**
     * Folds that were attempted but failed to fit or predict
     */
    int failedFolds;
    /**
     * True when no rolling-origin fold fitted inside the series and in-sample errors were used
     */
    boolean inSample;
    @With
    double weight;
}
