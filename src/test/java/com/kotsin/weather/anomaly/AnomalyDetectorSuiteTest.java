package com.kotsin.weather.anomaly;

import com.kotsin.weather.anomaly.impl.ChangePointDetector;
import com.kotsin.weather.anomaly.impl.ClusteringDistanceDetector;
import com.kotsin.weather.anomaly.impl.IqrDetector;
import com.kotsin.weather.anomaly.impl.IsolationForestDetector;
import com.kotsin.weather.anomaly.impl.ModifiedZScoreDetector;
import com.kotsin.weather.anomaly.impl.SeasonalResidualDetector;
import com.kotsin.weather.anomaly.impl.ZScoreDetector;
import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.domain.model.AnomalyFlag;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.domain.model.Diagnostic;
import com.kotsin.weather.domain.model.DiagnosticStatus;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.exception.AnomalyDetectionUnavailableException;
import com.kotsin.weather.metrics.PipelineMetrics;
import com.kotsin.weather.support.SeriesFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.kotsin.weather.support.SeriesFixtures.TEMPERATURE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnomalyDetectorSuite - parallel detectors and fused flags")
class AnomalyDetectorSuiteTest {

    private static final int SPIKE = 100;
    private static final LocalDate SPIKE_DATE = SeriesFixtures.START.plusDays(SPIKE);

    private ThreadPoolTaskExecutor executor;
    private PipelineMetrics metrics;
    private AnomalyDetectorSuite suite;
    private AnomalyConfig config;

    @BeforeEach
    void setUp() {
        executor = SeriesFixtures.executor("detector-test", 7);
        metrics = new PipelineMetrics();
        suite = new AnomalyDetectorSuite(List.of(
                new IqrDetector(),
                new ZScoreDetector(),
                new ModifiedZScoreDetector(),
                new SeasonalResidualDetector(),
                new IsolationForestDetector(),
                new ClusteringDistanceDetector(),
                new ChangePointDetector()), new DynamicThresholdEngine(), metrics, executor);
        config = AnomalyConfig.fromProperties(new WeatherInsightProperties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static TimeSeries spiked() {
        double[] values = SeriesFixtures.stable(120, 51L, 10.0);
        values[SPIKE] += 10.0;
        return SeriesFixtures.series("spike", values);
    }

    private AnomalyReport detect(TimeSeries modelInput, TimeSeries raw, AnomalyConfig cfg) {
        return suite.detect(modelInput, raw, List.of(TEMPERATURE), cfg, new DetectorStateArena());
    }

    // ========== Flagging Tests ==========

    @Test
    @DisplayName("A spike is flagged with the point detectors as contributors")
    void testSpikeFlagged() {
        TimeSeries series = spiked();

        AnomalyReport report = detect(series, series, config);

        AnomalyFlag flag = report.getFlags().stream()
                .filter(f -> f.getDate().equals(SPIKE_DATE))
                .findFirst()
                .orElseThrow();
        assertTrue(flag.getContributors().containsAll(
                List.of(DetectorType.IQR, DetectorType.Z_SCORE, DetectorType.MODIFIED_Z_SCORE)));
        assertTrue(flag.getSeverity() > flag.getThreshold());
        assertTrue(flag.getSeverity() >= 0.0 && flag.getSeverity() <= 1.0);
        assertEquals(7, report.getDetectorsRun().size());
        assertTrue(report.getDiagnostics().isEmpty());
        assertEquals(120, report.getSeverities().get(TEMPERATURE).length);
        assertTrue(report.getFinalThresholds().containsKey(TEMPERATURE));
        assertEquals(report.getFlags().size(), metrics.getFlagsEmitted());
    }

    @Test
    @DisplayName("Flags are ordered by date")
    void testFlagOrder() {
        TimeSeries series = spiked();

        List<LocalDate> dates = detect(series, series, config).getFlags().stream()
                .map(AnomalyFlag::getDate)
                .collect(Collectors.toList());

        for (int i = 1; i < dates.size(); i++) {
            assertFalse(dates.get(i).isBefore(dates.get(i - 1)));
        }
    }

    @Test
    @DisplayName("Imputed points are scored but never flagged")
    void testImputedPointNotFlagged() {
        TimeSeries modelInput = spiked();
        double[] rawValues = modelInput.values(TEMPERATURE);
        rawValues[SPIKE] = Double.NaN;
        TimeSeries raw = SeriesFixtures.series("spike", rawValues);

        AnomalyReport report = detect(modelInput, raw, config);

        assertTrue(report.getFlags().stream().noneMatch(f -> f.getDate().equals(SPIKE_DATE)));
        assertTrue(Double.isFinite(report.getSeverities().get(TEMPERATURE)[SPIKE]));
    }

    @Test
    @DisplayName("Repeated runs give identical flags")
    void testDeterministic() {
        TimeSeries series = spiked();

        AnomalyReport first = detect(series, series, config);
        AnomalyReport second = detect(series, series, config);

        assertEquals(first.getFlags(), second.getFlags());
    }

    @Test
    @DisplayName("A variable listed twice is scanned once with one contribution per detector")
    void testRepeatedVariableScannedOnce() {
        TimeSeries series = spiked();

        AnomalyReport report = suite.detect(series, series, List.of(TEMPERATURE, TEMPERATURE), config,
                new DetectorStateArena());

        AnomalyFlag flag = report.getFlags().stream()
                .filter(f -> f.getDate().equals(SPIKE_DATE))
                .findFirst()
                .orElseThrow();
        assertEquals(flag.getContributors().size(), EnumSet.copyOf(flag.getContributors()).size());
        assertEquals(1, report.getFlags().stream().filter(f -> f.getDate().equals(SPIKE_DATE)).count());
        assertEquals(1, report.getSeverities().size());
    }

    @Test
    @DisplayName("Severities handed out by a report cannot change it")
    void testReportSeveritiesImmutable() {
        TimeSeries series = spiked();
        AnomalyReport report = detect(series, series, config);
        double before = report.severitiesOf(TEMPERATURE)[SPIKE];

        report.getSeverities().get(TEMPERATURE)[SPIKE] = -1.0;
        report.severitiesOf(TEMPERATURE)[SPIKE] = -1.0;

        assertEquals(before, report.getSeverities().get(TEMPERATURE)[SPIKE]);
        assertThrows(UnsupportedOperationException.class,
                () -> report.getSeverities().put("humidity", new double[0]));
        assertThrows(UnsupportedOperationException.class,
                () -> report.getFinalThresholds().put("humidity", 0.5));
    }

    // ========== Failure Containment Tests ==========

    @Test
    @DisplayName("Detectors without enough data fail alone with diagnostics")
    void testDetectorFailureContained() {
        TimeSeries series = SeriesFixtures.series("short", SeriesFixtures.stable(10, 52L, 10.0));

        AnomalyReport report = detect(series, series, config);

        List<String> failed = report.getDiagnostics().stream()
                .filter(d -> d.getStatus() == DiagnosticStatus.DETECTOR_FAILED)
                .map(Diagnostic::getComponent)
                .collect(Collectors.toList());
        assertTrue(failed.containsAll(List.of("detector:seasonal-residual", "detector:isolation", "detector:change-point")));
        assertTrue(report.getDetectorsRun().contains(DetectorType.CLUSTERING_DISTANCE));
        assertFalse(report.getDetectorsRun().contains(DetectorType.ISOLATION));
        assertEquals(1L, metrics.getDetectorFailures().get("isolation"));
    }

    @Test
    @DisplayName("Detection fails as a whole only when every detector fails")
    void testAllDetectorsFail() {
        TimeSeries series = SeriesFixtures.series("short", SeriesFixtures.stable(10, 53L, 10.0));
        AnomalyConfig isolationOnly = config.toBuilder().detectors(EnumSet.of(DetectorType.ISOLATION)).build();

        assertThrows(AnomalyDetectionUnavailableException.class, () -> detect(series, series, isolationOnly));
    }

    // ========== Configuration Tests ==========

    @Test
    @DisplayName("Disabled and zero-weight detectors do not run")
    void testDisabledDetectors() {
        TimeSeries series = spiked();
        AnomalyConfig reduced = config.toBuilder()
                .detectors(EnumSet.of(DetectorType.Z_SCORE, DetectorType.IQR, DetectorType.CHANGE_POINT))
                .weights(Map.of(DetectorType.CHANGE_POINT, 0.0))
                .build();

        AnomalyReport report = detect(series, series, reduced);

        assertEquals(List.of(DetectorType.IQR, DetectorType.Z_SCORE), report.getDetectorsRun().stream()
                .sorted()
                .collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Fused severity is the weighted mean of the defined normalized scores")
    void testFusedSeverity() {
        AnomalyConfig weighted = config.toBuilder()
                .weights(Map.of(DetectorType.IQR, 1.0, DetectorType.Z_SCORE, 3.0))
                .build();
        List<DetectorScores> scores = List.of(
                new DetectorScores(DetectorType.IQR, new double[]{1.0}, 1.0),
                new DetectorScores(DetectorType.Z_SCORE, new double[]{0.0}, 3.0),
                new DetectorScores(DetectorType.CHANGE_POINT, new double[]{Double.NaN}, 4.0));

        // (1 * 0.5 + 3 * 0.0) / 4
        assertEquals(0.125, AnomalyDetectorSuite.fusedSeverity(scores, weighted, 0), 1e-12);
    }
}
