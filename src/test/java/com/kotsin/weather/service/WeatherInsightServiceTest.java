package com.kotsin.weather.service;

import com.kotsin.weather.anomaly.AnomalyDetectorSuite;
import com.kotsin.weather.anomaly.DynamicThresholdEngine;
import com.kotsin.weather.anomaly.impl.ChangePointDetector;
import com.kotsin.weather.anomaly.impl.ClusteringDistanceDetector;
import com.kotsin.weather.anomaly.impl.IqrDetector;
import com.kotsin.weather.anomaly.impl.IsolationForestDetector;
import com.kotsin.weather.anomaly.impl.ModifiedZScoreDetector;
import com.kotsin.weather.anomaly.impl.SeasonalResidualDetector;
import com.kotsin.weather.anomaly.impl.ZScoreDetector;
import com.kotsin.weather.cache.InsightResultCache;
import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.domain.model.Diagnostic;
import com.kotsin.weather.domain.model.DiagnosticStatus;
import com.kotsin.weather.domain.model.ForecastPoint;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.domain.model.ValidationMetric;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.exception.ResourceExhaustedException;
import com.kotsin.weather.forecast.CrossValidator;
import com.kotsin.weather.forecast.EnsembleCombiner;
import com.kotsin.weather.forecast.ForecastModelFactory;
import com.kotsin.weather.forecast.ForecastOrchestrator;
import com.kotsin.weather.forecast.ModelStatus;
import com.kotsin.weather.metrics.PipelineMetrics;
import com.kotsin.weather.monitoring.ResourceGovernor;
import com.kotsin.weather.quality.DataQualityAssessor;
import com.kotsin.weather.support.SeriesFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.kotsin.weather.support.SeriesFixtures.TEMPERATURE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WeatherInsightService - end-to-end forecast and anomaly requests")
class WeatherInsightServiceTest {

    private WeatherInsightProperties properties;
    private PipelineMetrics metrics;
    private ThreadPoolTaskExecutor modelExecutor;
    private ThreadPoolTaskExecutor validationExecutor;
    private ThreadPoolTaskExecutor detectorExecutor;
    private WeatherInsightService service;

    @BeforeEach
    void setUp() {
        properties = new WeatherInsightProperties();
        properties.getGovernor().setHeapRejectRatio(1.0);
        metrics = new PipelineMetrics();
        modelExecutor = SeriesFixtures.executor("model-test", 4);
        validationExecutor = SeriesFixtures.executor("cv-test", 4);
        detectorExecutor = SeriesFixtures.executor("detector-test", 7);
        service = newService();
    }

    @AfterEach
    void tearDown() {
        modelExecutor.shutdown();
        validationExecutor.shutdown();
        detectorExecutor.shutdown();
    }

    private WeatherInsightService newService() {
        ForecastModelFactory factory = new ForecastModelFactory();
        ResourceGovernor governor = new ResourceGovernor(properties, metrics);
        ForecastOrchestrator orchestrator = new ForecastOrchestrator(factory, new CrossValidator(validationExecutor),
                governor, metrics, modelExecutor);
        AnomalyDetectorSuite suite = new AnomalyDetectorSuite(List.of(
                new IqrDetector(),
                new ZScoreDetector(),
                new ModifiedZScoreDetector(),
                new SeasonalResidualDetector(),
                new IsolationForestDetector(),
                new ClusteringDistanceDetector(),
                new ChangePointDetector()), new DynamicThresholdEngine(), metrics, detectorExecutor);
        InsightResultCache cache = new InsightResultCache(properties, metrics);
        cache.init();
        return new WeatherInsightService(properties, new RequestValidator(), new DataQualityAssessor(properties, factory),
                orchestrator, new EnsembleCombiner(), suite, governor, cache, metrics);
    }

    private static InsightRequest.InsightRequestBuilder request(TimeSeries series) {
        return InsightRequest.builder()
                .series(series)
                .variable(TEMPERATURE)
                .model("seasonal-decomposition")
                .model("autoregressive");
    }

    // ========== Full Pipeline Tests ==========

    @Test
    @DisplayName("Long seasonal series yields a weighted ensemble over every model")
    void testLongSeasonalSeries() {
        TimeSeries series = SeriesFixtures.series("long", SeriesFixtures.seasonal(800, 71L, 0.5));

        InsightResult result = service.analyze(request(series)
                .seasonalPeriods(Set.of(7, 365))
                .horizon(7)
                .build());

        assertEquals(7, result.getForecast().horizon());
        LocalDate expected = series.lastDate().plusDays(1);
        for (ForecastPoint p : result.getForecast().getPoints()) {
            assertEquals(expected, p.getDate());
            assertTrue(p.getLower() <= p.getPoint() && p.getPoint() <= p.getUpper());
            expected = expected.plusDays(1);
        }
        assertEquals(1.0, result.getEnsemble().weightSum(), 1e-9);
        assertFalse(result.isLowConfidence());
        assertEquals(2, result.getRankedMetrics().size());
        assertEquals(result.getRankedMetrics().get(0).getVariant(), result.getBestModel());
        assertTrue(result.getRankedMetrics().stream().noneMatch(ValidationMetric::isInSample));
        assertEquals(2, result.getAdapterForecasts().size());
        assertTrue(result.getDiagnostics().stream().noneMatch(d -> d.getComponent().startsWith("model:")));
        assertEquals(1.0, result.getQuality().getCompleteness(), 1e-12);
        assertEquals(1, metrics.getRequests());
    }

    @Test
    @DisplayName("Very short series degrades to one in-sample model and reports the rest as diagnostics")
    void testShortSeriesDegrades() {
        TimeSeries series = SeriesFixtures.series("short", SeriesFixtures.seasonal(10, 72L, 0.5));

        InsightResult result = service.analyze(request(series)
                .seasonalPeriods(Set.of(365))
                .build());

        assertTrue(result.isLowConfidence());
        assertEquals(ModelVariant.AUTOREGRESSIVE, result.getBestModel());
        assertEquals(1.0, result.getRankedMetrics().get(0).getWeight(), 1e-12);
        assertTrue(result.getRankedMetrics().get(0).isInSample());

        Diagnostic sd = result.getDiagnostics().stream()
                .filter(d -> d.getComponent().equals("model:seasonal-decomposition"))
                .findFirst()
                .orElseThrow();
        assertEquals(DiagnosticStatus.INSUFFICIENT_DATA, sd.getStatus());

        List<String> failedDetectors = result.getDiagnostics().stream()
                .filter(d -> d.getStatus() == DiagnosticStatus.DETECTOR_FAILED)
                .map(Diagnostic::getComponent)
                .collect(Collectors.toList());
        assertTrue(failedDetectors.contains("detector:isolation"));
        assertNotNull(result.getAnomalies());
    }

    @Test
    @DisplayName("Adapter forecasts are omitted when not requested")
    void testAdapterForecastsOmitted() {
        TimeSeries series = SeriesFixtures.series("slim", SeriesFixtures.seasonal(120, 73L, 0.5));

        InsightResult result = service.analyze(request(series)
                .seasonalPeriods(Set.of(7))
                .cvFolds(3)
                .includeAdapterForecasts(false)
                .build());

        assertTrue(result.getAdapterForecasts().isEmpty());
        assertNotNull(result.getForecast());
    }

    // ========== Determinism and Cache Tests ==========

    @Test
    @DisplayName("Identical requests give identical results without the cache")
    void testIdempotent() {
        properties.getCache().setEnabled(false);
        service = newService();
        TimeSeries series = SeriesFixtures.series("same", SeriesFixtures.seasonal(120, 74L, 0.5));
        InsightRequest req = request(series).seasonalPeriods(Set.of(7)).cvFolds(3).build();

        InsightResult first = service.analyze(req);
        InsightResult second = service.analyze(req);

        assertNotSame(first, second);
        assertArrayEquals(first.getForecast().pointEstimates(), second.getForecast().pointEstimates(), 1e-12);
        assertEquals(first.getAnomalies().getFlags(), second.getAnomalies().getFlags());
        assertEquals(0, metrics.getCacheHits());
    }

    @Test
    @DisplayName("A repeated request is served from the cache")
    void testCacheHit() {
        TimeSeries series = SeriesFixtures.series("cached", SeriesFixtures.seasonal(120, 75L, 0.5));
        InsightRequest req = request(series).seasonalPeriods(Set.of(7)).cvFolds(3).build();

        InsightResult first = service.analyze(req);
        InsightResult second = service.analyze(req);

        assertSame(first, second);
        assertEquals(1, metrics.getCacheHits());

        InsightResult other = service.analyze(req.toBuilder().horizon(3).build());
        assertEquals(3, other.getForecast().horizon());
    }

    // ========== Terminal Failure Tests ==========

    @Test
    @DisplayName("Invalid requests fail before any fitting")
    void testInvalidRequest() {
        TimeSeries series = SeriesFixtures.series("bad", SeriesFixtures.seasonal(60, 76L, 0.5));

        Outcome<InsightResult> outcome = service.tryAnalyze(request(series).horizon(0).build());

        assertTrue(outcome.isFailure());
        assertEquals("ERR-CFG-001", outcome.getErrorCode());
        assertEquals(1, metrics.getTerminalFailures());
        assertEquals(0, metrics.getModelOutcomes(ModelVariant.AUTOREGRESSIVE, ModelStatus.SUCCEEDED));
    }

    @Test
    @DisplayName("A series too short for every model is a terminal failure")
    void testNoModelCanFit() {
        TimeSeries series = SeriesFixtures.series("tiny", SeriesFixtures.seasonal(10, 77L, 0.5));
        InsightRequest req = InsightRequest.builder()
                .series(series)
                .variable(TEMPERATURE)
                .model("seasonal-decomposition")
                .seasonalPeriods(Set.of(365))
                .build();

        InsufficientDataException e = assertThrows(InsufficientDataException.class, () -> service.analyze(req));
        assertEquals(730, e.getRequired());
    }

    @Test
    @DisplayName("Requests over the memory budget are rejected by the governor")
    void testGovernorRejection() {
        properties.getGovernor().setMemoryBudgetMb(1);
        service = newService();
        TimeSeries series = SeriesFixtures.series("big", SeriesFixtures.seasonal(800, 78L, 0.5));

        Outcome<InsightResult> outcome = service.tryAnalyze(request(series).seasonalPeriods(Set.of(7)).build());

        assertTrue(outcome.isFailure());
        assertInstanceOf(ResourceExhaustedException.class, outcome.getFailure());
        assertEquals(1, metrics.getGovernorRejections());
    }
}
