package com.kotsin.weather.anomaly;

import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.domain.model.DetectorType;
import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detector suite configuration of one request: enabled detectors, fusion weights, detector parameters
 * and dynamic threshold settings.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyConfig {

    Set<DetectorType> detectors;
    Map<DetectorType, Double> weights;

    double iqrMultiplier;
    int iqrWindow;
    int zscoreWindow;
    double zscoreThreshold;
    double modifiedZscoreThreshold;
    int modifiedZscoreWindow;
    int seasonalPeriod;
    double seasonalResidualThreshold;
    int isolationTrees;
    int isolationSubsample;
    int clusterCount;
    double clusterThreshold;
    double minClusterFraction;
    int changePointWindow;
    double changePointThreshold;
    long seed;

    int thresholdWindow;
    double thresholdZ;
    int coldStartSamples;
    double fallbackThreshold;

    /**
     * Fusion weight of a detector, 1 when not configured
     */
    public double weight(DetectorType type) {
        Double w = weights == null ? null : weights.get(type);
        return w == null ? 1.0 : w;
    }

    public boolean isEnabled(DetectorType type) {
        return detectors == null || detectors.isEmpty() || detectors.contains(type);
    }

    /**
     * Defaults from the application properties
     */
    public static AnomalyConfig fromProperties(WeatherInsightProperties properties) {
        WeatherInsightProperties.DetectionConfig a = properties.getAnomaly();
        WeatherInsightProperties.ThresholdConfig t = properties.getThreshold();

        Set<DetectorType> enabled = EnumSet.noneOf(DetectorType.class);
        a.getDetectors().forEach(id -> enabled.add(detectorType(id)));
        Map<DetectorType, Double> weights = new EnumMap<>(DetectorType.class);
        a.getDetectorWeights().forEach((id, w) -> weights.put(detectorType(id), w));

        return AnomalyConfig.builder()
                .detectors(enabled.isEmpty() ? EnumSet.allOf(DetectorType.class) : enabled)
                .weights(Collections.unmodifiableMap(weights))
                .iqrMultiplier(a.getIqrMultiplier())
                .iqrWindow(a.getIqrWindow())
                .zscoreWindow(a.getZscoreWindow())
                .zscoreThreshold(a.getZscoreThreshold())
                .modifiedZscoreThreshold(a.getModifiedZscoreThreshold())
                .modifiedZscoreWindow(a.getModifiedZscoreWindow())
                .seasonalPeriod(a.getSeasonalPeriod())
                .seasonalResidualThreshold(a.getSeasonalResidualThreshold())
                .isolationTrees(a.getIsolationTrees())
                .isolationSubsample(a.getIsolationSubsample())
                .clusterCount(a.getClusterCount())
                .clusterThreshold(a.getClusterThreshold())
                .minClusterFraction(a.getMinClusterFraction())
                .changePointWindow(a.getChangePointWindow())
                .changePointThreshold(a.getChangePointThreshold())
                .seed(a.getSeed())
                .thresholdWindow(t.getWindow())
                .thresholdZ(t.getZ())
                .coldStartSamples(t.getColdStartSamples())
                .fallbackThreshold(t.getFallback())
                .build();
    }

    /**
     * Resolve a detector from its id (e.g. {@code z-score}) or enum name
     */
    public static DetectorType detectorType(String id) {
        String key = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(DetectorType.values())
                .filter(d -> d.getId().equals(key) || d.name().toLowerCase(Locale.ROOT).equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown detector: " + id));
    }
}
