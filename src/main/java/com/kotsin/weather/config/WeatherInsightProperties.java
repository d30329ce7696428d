package com.kotsin.weather.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized defaults for the forecasting and anomaly pipeline.
 * Per-request values in {@code InsightRequest} override these.
 */
@Configuration
@ConfigurationProperties(prefix = "weather.insight")
@Data
public class WeatherInsightProperties {

    private QualityConfig quality = new QualityConfig();

    private ForecastConfig forecast = new ForecastConfig();

    private DetectionConfig anomaly = new DetectionConfig();

    private ThresholdConfig threshold = new ThresholdConfig();

    private GovernorConfig governor = new GovernorConfig();

    private CacheConfig cache = new CacheConfig();

    private ExecutorConfig executor = new ExecutorConfig();

    @Data
    public static class QualityConfig {
        /**
         * Longest run of missing values filled by linear interpolation
         */
        private int maxLinearGap = 3;

        /**
         * Longest run of missing values imputed at all; longer gaps stay missing
         */
        private int maxImputationGap = 14;

        /**
         * Absolute minimum series length regardless of configured models
         */
        private int minimumSeriesLength = 7;

        /**
         * Day-over-day change, in robust standard deviations, counted as an implausible jump
         */
        private double jumpFactor = 6.0;

        /**
         * Lag in days after which timeliness reaches zero
         */
        private int timelinessHorizonDays = 30;

        private double completenessWeight = 0.4;
        private double consistencyWeight = 0.2;
        private double accuracyWeight = 0.3;
        private double timelinessWeight = 0.1;
    }

    @Data
    public static class ForecastConfig {
        private int horizon = 7;

        private List<Integer> seasonalPeriods = new ArrayList<>(List.of(7, 365));

        /**
         * Model variant ids run when a request does not name its models
         */
        private List<String> models = new ArrayList<>(List.of(
                "seasonal-decomposition", "trend-holiday", "autoregressive", "sequence-learning"));

        private int cvFolds = 5;

        /**
         * Bounds fit, validation and prediction of one adapter
         */
        private double perModelTimeoutSeconds = 60.0;

        /**
         * Two-sided coverage of the prediction intervals
         */
        private double confidenceLevel = 0.95;

        /**
         * Longest series accepted by the sequence-learning model
         */
        private int maxSeriesLengthForSequenceModel = 3650;
    }

    @Data
    public static class DetectionConfig {
        /**
         * Detector ids to run; empty means all seven
         */
        private List<String> detectors = new ArrayList<>();

        /**
         * Fusion weight per detector id in [0, 1]; detectors not listed get weight 1
         */
        private Map<String, Double> detectorWeights = new LinkedHashMap<>();

        private double iqrMultiplier = 1.5;
        private int iqrWindow = 90;

        private int zscoreWindow = 30;
        private double zscoreThreshold = 3.0;

        private double modifiedZscoreThreshold = 3.5;
        private int modifiedZscoreWindow = 90;

        private double seasonalResidualThreshold = 3.0;
        private int seasonalPeriod = 7;

        private int isolationTrees = 64;
        private int isolationSubsample = 128;

        private int clusterCount = 4;
        private double clusterThreshold = 3.0;

        /**
         * Clusters holding less than this share of the points are not treated as dense regions
         */
        private double minClusterFraction = 0.02;

        private int changePointWindow = 14;
        private double changePointThreshold = 4.0;

        /**
         * Seed for the randomized detectors, so repeated runs agree
         */
        private long seed = 42L;
    }

    @Data
    public static class ThresholdConfig {
        private int window = 90;
        private double z = 2.5;

        /**
         * Samples needed before the dynamic threshold replaces the fallback
         */
        private int coldStartSamples = 30;

        private double fallback = 0.7;
    }

    @Data
    public static class GovernorConfig {
        /**
         * Aggregate working-set budget across in-flight requests
         */
        private long memoryBudgetMb = 512;

        /**
         * Reject new requests when JVM heap usage exceeds this fraction
         */
        private double heapRejectRatio = 0.9;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private long maximumSize = 256;
        private long expireAfterWriteMinutes = 30;
    }

    @Data
    public static class ExecutorConfig {
        private int modelPoolSize = 4;
        private int validationPoolSize = 8;
        private int detectorPoolSize = 7;
        private int queueCapacity = 200;
    }
}
