package com.kotsin.weather.config;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates the {@code weather.insight} defaults on startup and fails fast on a bad value.
 */
@Component
@Slf4j
public class ConfigurationValidator {

    private final WeatherInsightProperties properties;
    private final Environment environment;

    public ConfigurationValidator(WeatherInsightProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        // Skip validation in test mode
        if (environment.matchesProfiles("test")) {
            log.info("Skipping configuration validation in test mode");
            return;
        }

        log.info("Validating weather.insight configuration...");
        List<String> errors = validate(properties);

        if (!errors.isEmpty()) {
            log.error("Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        log.info("Configuration validation passed");
        logConfigurationSummary();
    }

    /**
     * All violations of the given properties, empty when valid
     */
    public static List<String> validate(WeatherInsightProperties properties) {
        List<String> errors = new ArrayList<>();

        WeatherInsightProperties.ForecastConfig forecast = properties.getForecast();
        if (forecast.getHorizon() <= 0) {
            errors.add("weather.insight.forecast.horizon must be > 0");
        }
        if (forecast.getCvFolds() < 2) {
            errors.add("weather.insight.forecast.cv-folds must be >= 2");
        }
        if (!(forecast.getPerModelTimeoutSeconds() > 0)) {
            errors.add("weather.insight.forecast.per-model-timeout-seconds must be > 0");
        }
        if (forecast.getMaxSeriesLengthForSequenceModel() <= 0) {
            errors.add("weather.insight.forecast.max-series-length-for-sequence-model must be > 0");
        }
        if (!(forecast.getConfidenceLevel() > 0 && forecast.getConfidenceLevel() < 1)) {
            errors.add("weather.insight.forecast.confidence-level must be in (0, 1)");
        }
        forecast.getSeasonalPeriods().stream()
                .filter(p -> p == null || p <= 0)
                .forEach(p -> errors.add("weather.insight.forecast.seasonal-periods contains invalid period " + p));
        for (String model : forecast.getModels()) {
            try {
                ModelVariant.fromId(model);
            } catch (IllegalArgumentException e) {
                errors.add("weather.insight.forecast.models: " + e.getMessage());
            }
        }

        WeatherInsightProperties.DetectionConfig anomaly = properties.getAnomaly();
        for (String detector : anomaly.getDetectors()) {
            try {
                AnomalyConfig.detectorType(detector);
            } catch (IllegalArgumentException e) {
                errors.add("weather.insight.anomaly.detectors: " + e.getMessage());
            }
        }
        for (Map.Entry<String, Double> weight : anomaly.getDetectorWeights().entrySet()) {
            try {
                AnomalyConfig.detectorType(weight.getKey());
            } catch (IllegalArgumentException e) {
                errors.add("weather.insight.anomaly.detector-weights: " + e.getMessage());
            }
            Double w = weight.getValue();
            if (w == null || !(w >= 0 && w <= 1)) {
                errors.add("weather.insight.anomaly.detector-weights." + weight.getKey() + " must be in [0, 1]");
            }
        }
        if (anomaly.getIqrMultiplier() <= 0 || anomaly.getZscoreThreshold() <= 0
                || anomaly.getModifiedZscoreThreshold() <= 0 || anomaly.getSeasonalResidualThreshold() <= 0
                || anomaly.getClusterThreshold() <= 0 || anomaly.getChangePointThreshold() <= 0) {
            errors.add("weather.insight.anomaly detector cutoffs must be > 0");
        }
        if (anomaly.getIqrWindow() < 3 || anomaly.getZscoreWindow() < 3 || anomaly.getModifiedZscoreWindow() < 3
                || anomaly.getChangePointWindow() < 3) {
            errors.add("weather.insight.anomaly windows must be >= 3");
        }
        if (anomaly.getClusterCount() < 1 || anomaly.getIsolationTrees() < 1 || anomaly.getIsolationSubsample() < 2) {
            errors.add("weather.insight.anomaly cluster-count, isolation-trees and isolation-subsample out of range");
        }

        WeatherInsightProperties.ThresholdConfig threshold = properties.getThreshold();
        if (!(threshold.getZ() > 0)) {
            errors.add("weather.insight.threshold.z must be > 0");
        }
        if (threshold.getWindow() < 2) {
            errors.add("weather.insight.threshold.window must be >= 2");
        }
        if (threshold.getColdStartSamples() < 0) {
            errors.add("weather.insight.threshold.cold-start-samples must be >= 0");
        }
        if (!(threshold.getFallback() > 0 && threshold.getFallback() <= 1)) {
            errors.add("weather.insight.threshold.fallback must be in (0, 1]");
        }

        WeatherInsightProperties.QualityConfig quality = properties.getQuality();
        if (quality.getMaxLinearGap() < 0 || quality.getMaxImputationGap() < quality.getMaxLinearGap()) {
            errors.add("weather.insight.quality: need 0 <= max-linear-gap <= max-imputation-gap");
        }
        if (quality.getMinimumSeriesLength() < 2) {
            errors.add("weather.insight.quality.minimum-series-length must be >= 2");
        }

        if (properties.getGovernor().getMemoryBudgetMb() <= 0) {
            errors.add("weather.insight.governor.memory-budget-mb must be > 0");
        }
        WeatherInsightProperties.ExecutorConfig executor = properties.getExecutor();
        if (executor.getModelPoolSize() < 1 || executor.getValidationPoolSize() < 1
                || executor.getDetectorPoolSize() < 1) {
            errors.add("weather.insight.executor pool sizes must be >= 1");
        }
        return errors;
    }

    private void logConfigurationSummary() {
        WeatherInsightProperties.ForecastConfig forecast = properties.getForecast();
        log.info("Configuration Summary:");
        log.info("  Models: {} | horizon={} | periods={} | cvFolds={}", forecast.getModels(),
                forecast.getHorizon(), forecast.getSeasonalPeriods(), forecast.getCvFolds());
        log.info("  Per-model timeout: {}s | sequence model cap: {} points",
                forecast.getPerModelTimeoutSeconds(), forecast.getMaxSeriesLengthForSequenceModel());
        log.info("  Threshold: window={} z={} coldStart={} fallback={}", properties.getThreshold().getWindow(),
                properties.getThreshold().getZ(), properties.getThreshold().getColdStartSamples(),
                properties.getThreshold().getFallback());
        log.info("  Memory budget: {}MB | cache enabled={}", properties.getGovernor().getMemoryBudgetMb(),
                properties.getCache().isEnabled());
    }
}
