package com.kotsin.weather.service;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.exception.InvalidConfigException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rejects a malformed request before any fitting starts.
 */
@Component
public class RequestValidator {

    /**
     * @throws InvalidConfigException listing every violation found
     */
    public void validate(InsightRequest request) {
        List<String> violations = new ArrayList<>();
        if (request == null) {
            throw new InvalidConfigException("request is required");
        }
        if (request.getSeries() == null || request.getSeries().isEmpty()) {
            violations.add("series must contain at least one point");
        } else {
            if (request.getVariable() == null || !request.getSeries().hasVariable(request.getVariable())) {
                violations.add("variable " + request.getVariable() + " is not in the series "
                        + request.getSeries().getVariables());
            }
            Set<String> anomalyVariables = new HashSet<>();
            for (String v : request.getAnomalyVariables()) {
                if (!request.getSeries().hasVariable(v)) {
                    violations.add("anomaly variable " + v + " is not in the series");
                } else if (!anomalyVariables.add(v)) {
                    violations.add("anomaly variable " + v + " is requested twice");
                }
            }
        }

        Set<ModelVariant> seen = EnumSet.noneOf(ModelVariant.class);
        for (String id : request.getModels()) {
            ModelVariant variant = variant(id, violations);
            if (variant != null && !seen.add(variant)) {
                violations.add("model " + id + " is configured twice");
            }
        }
        for (String id : request.getHyperparameters().keySet()) {
            variant(id, violations);
        }

        if (request.getHorizon() != null && request.getHorizon() <= 0) {
            violations.add("horizon must be > 0, got " + request.getHorizon());
        }
        if (request.getSeasonalPeriods() != null) {
            request.getSeasonalPeriods().stream()
                    .filter(p -> p == null || p <= 0)
                    .forEach(p -> violations.add("seasonal period must be > 0, got " + p));
        }
        if (request.getCvFolds() != null && request.getCvFolds() < 2) {
            violations.add("cv_folds must be >= 2, got " + request.getCvFolds());
        }
        if (request.getDynamicThresholdZ() != null && !(request.getDynamicThresholdZ() > 0)) {
            violations.add("dynamic_threshold_z must be > 0, got " + request.getDynamicThresholdZ());
        }
        if (request.getPerModelTimeoutSeconds() != null && !(request.getPerModelTimeoutSeconds() > 0)) {
            violations.add("per_model_timeout_seconds must be > 0, got " + request.getPerModelTimeoutSeconds());
        }
        if (request.getMaxSeriesLengthForSequenceModel() != null && request.getMaxSeriesLengthForSequenceModel() <= 0) {
            violations.add("max_series_length_for_sequence_model must be > 0, got "
                    + request.getMaxSeriesLengthForSequenceModel());
        }
        if (request.getCacheExpiry() != null && request.getCacheExpiry().isNegative()) {
            violations.add("cache expiry must not be negative");
        }

        Set<DetectorType> enabled = EnumSet.noneOf(DetectorType.class);
        for (String id : request.getDetectors()) {
            DetectorType type = detector(id, violations);
            if (type != null) {
                enabled.add(type);
            }
        }
        if (enabled.isEmpty()) {
            enabled = EnumSet.allOf(DetectorType.class);
        }
        if (!request.getDetectorWeights().isEmpty()) {
            double enabledWeight = 0;
            boolean weightsValid = true;
            Set<DetectorType> weighted = EnumSet.noneOf(DetectorType.class);
            for (Map.Entry<String, Double> e : request.getDetectorWeights().entrySet()) {
                DetectorType type = detector(e.getKey(), violations);
                Double w = e.getValue();
                if (type != null) {
                    weighted.add(type);
                }
                if (w == null || !(w >= 0 && w <= 1)) {
                    violations.add("detector weight of " + e.getKey() + " must be in [0, 1], got " + w);
                    weightsValid = false;
                } else if (type != null && enabled.contains(type)) {
                    enabledWeight += w;
                }
            }
            boolean allWeighted = weighted.containsAll(enabled);
            if (weightsValid && allWeighted && enabledWeight <= 0) {
                violations.add("detector weights leave every enabled detector at zero");
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigException(violations);
        }
    }

    private static ModelVariant variant(String id, List<String> violations) {
        try {
            return ModelVariant.fromId(id);
        } catch (IllegalArgumentException e) {
            violations.add(e.getMessage());
            return null;
        }
    }

    private static DetectorType detector(String id, List<String> violations) {
        try {
            return AnomalyConfig.detectorType(id);
        } catch (IllegalArgumentException e) {
            violations.add(e.getMessage());
            return null;
        }
    }
}
