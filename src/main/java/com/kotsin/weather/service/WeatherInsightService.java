package com.kotsin.weather.service;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.anomaly.AnomalyDetectorSuite;
import com.kotsin.weather.anomaly.AnomalyReport;
import com.kotsin.weather.anomaly.DetectorStateArena;
import com.kotsin.weather.cache.InsightResultCache;
import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.domain.model.Diagnostic;
import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.domain.model.ValidationMetric;
import com.kotsin.weather.domain.validator.SeriesSanityValidator;
import com.kotsin.weather.exception.AnomalyDetectionUnavailableException;
import com.kotsin.weather.exception.WeatherInsightException;
import com.kotsin.weather.forecast.CrossValidator;
import com.kotsin.weather.forecast.EnsembleCombiner;
import com.kotsin.weather.forecast.EnsembleForecast;
import com.kotsin.weather.forecast.ForecastOrchestrator;
import com.kotsin.weather.forecast.ModelOutcome;
import com.kotsin.weather.forecast.PredictionIntervals;
import com.kotsin.weather.metrics.PipelineMetrics;
import com.kotsin.weather.monitoring.ResourceGovernor;
import com.kotsin.weather.quality.DataQualityAssessor;
import com.kotsin.weather.quality.QualityAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * WeatherInsightService - request boundary of the forecasting and anomaly core.
 *
 * Pipeline:
 * 1. validate the request (fail fast, nothing is fitted)
 * 2. serve from cache when the same series and configuration were analyzed recently
 * 3. reserve working-set memory with the governor
 * 4. assess quality and build the cleaned and complete series
 * 5. start anomaly detection in the background
 * 6. run all forecasting models, cross-validate them and combine the survivors
 * 7. join the anomaly report and assemble the result with every diagnostic
 *
 * Only a request with no viable forecast or no working detector fails; any other failure is reported in
 * the result's diagnostics.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WeatherInsightService {

    private final WeatherInsightProperties properties;
    private final RequestValidator requestValidator;
    private final DataQualityAssessor qualityAssessor;
    private final ForecastOrchestrator orchestrator;
    private final EnsembleCombiner combiner;
    private final AnomalyDetectorSuite detectorSuite;
    private final ResourceGovernor governor;
    private final InsightResultCache cache;
    private final PipelineMetrics metrics;

    private final AtomicLong requestCounter = new AtomicLong();

    /**
     * Analyze a series, returning the value or a terminal failure as an {@link Outcome}.
     */
    public Outcome<InsightResult> tryAnalyze(InsightRequest request) {
        try {
            InsightResult result = analyze(request);
            return Outcome.success(result, result.getDiagnostics());
        } catch (WeatherInsightException e) {
            return Outcome.failure(e);
        }
    }

    /**
     * Analyze a series.
     *
     * @throws WeatherInsightException on invalid configuration, governor rejection, or when no forecast
     *                                 or no detector could be produced
     */
    public InsightResult analyze(InsightRequest request) {
        metrics.incRequest();
        try {
            return doAnalyze(request);
        } catch (WeatherInsightException e) {
            metrics.incTerminalFailure();
            log.error("[INSIGHT] Request failed [{}]: {}", e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private InsightResult doAnalyze(InsightRequest request) {
        requestValidator.validate(request);
        TimeSeries series = request.getSeries();
        ResolvedRequest resolved = resolve(request);
        String requestId = series.getSeriesId() + "-" + requestCounter.incrementAndGet();

        String cacheKey = cache.key(series.contentHash(), resolved);
        InsightResult cached = cache.get(cacheKey).orElse(null);
        if (cached != null) {
            log.info("[INSIGHT] {} served from cache", requestId);
            return cached;
        }

        long start = System.currentTimeMillis();
        log.info("[INSIGHT] {} start: {} points, variable={}, models={}", requestId, series.size(),
                resolved.getVariable(), resolved.getModels().stream()
                        .map(m -> m.getVariant().getId()).collect(Collectors.toList()));

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String violation : SeriesSanityValidator.validate(series)) {
            log.warn("[INSIGHT] {} sanity: {}", requestId, violation);
            diagnostics.add(Diagnostic.warning("quality", violation));
        }

        long bytes = governor.estimateBytes(series.size(), series.getVariables().size(),
                resolved.getModels().size(), resolved.getAnomaly().getDetectors().size());
        InsightResult result;
        try (ResourceGovernor.Reservation reservation = governor.reserve(requestId, bytes)) {
            result = run(requestId, request, resolved, diagnostics);
        }

        cache.put(cacheKey, result, request.getCacheExpiry());
        log.info("[INSIGHT] {} done in {}ms: best={} flags={} diagnostics={}", requestId,
                System.currentTimeMillis() - start, result.getBestModel() == null ? "-" : result.getBestModel().getId(),
                result.getAnomalies().getFlags().size(), result.getDiagnostics().size());
        return result;
    }

    private InsightResult run(String requestId, InsightRequest request, ResolvedRequest resolved,
                              List<Diagnostic> diagnostics) {
        TimeSeries series = request.getSeries();
        QualityAssessment assessment = qualityAssessor.assess(series, resolved.getModels(), request.getAsOf());
        TimeSeries modelInput = assessment.getModelInput();

        DetectorStateArena arena = new DetectorStateArena();
        CompletableFuture<AnomalyReport> anomalies = detectorSuite.detectAsync(modelInput, series,
                resolved.getAnomalyVariables(), resolved.getAnomaly(), arena);

        EnsembleForecast ensemble;
        List<ModelOutcome> outcomes;
        try {
            outcomes = orchestrator.run(modelInput, resolved.getVariable(), resolved.getModels(),
                    resolved.getCvFolds(), Duration.ofMillis(Math.round(resolved.getPerModelTimeoutSeconds() * 1000)),
                    resolved.getMaxSeriesLengthForSequenceModel());

            Map<ModelVariant, ForecastResult> forecasts = new EnumMap<>(ModelVariant.class);
            Map<ModelVariant, ValidationMetric> validation = new EnumMap<>(ModelVariant.class);
            for (ModelOutcome outcome : outcomes) {
                if (outcome.isSucceeded()) {
                    forecasts.put(outcome.getVariant(), outcome.getForecast());
                    validation.put(outcome.getVariant(), outcome.getMetric());
                } else {
                    diagnostics.add(outcome.getDiagnostic());
                }
            }
            ensemble = combiner.combine(forecasts, validation);
        } catch (WeatherInsightException e) {
            anomalies.cancel(true);
            throw e;
        }

        AnomalyReport report = join(anomalies);
        diagnostics.addAll(report.getDiagnostics());

        List<ValidationMetric> ranked = outcomes.stream()
                .filter(ModelOutcome::isSucceeded)
                .map(o -> o.getMetric().withWeight(ensemble.getWeights().getOrDefault(o.getVariant(), 0.0)))
                .sorted(CrossValidator.RANKING)
                .collect(Collectors.toList());

        Map<ModelVariant, ForecastResult> adapterForecasts = new EnumMap<>(ModelVariant.class);
        if (resolved.isIncludeAdapterForecasts()) {
            outcomes.stream().filter(ModelOutcome::isSucceeded)
                    .forEach(o -> adapterForecasts.put(o.getVariant(), o.getForecast()));
        }

        return InsightResult.builder()
                .requestId(requestId)
                .seriesId(series.getSeriesId())
                .variable(resolved.getVariable())
                .quality(assessment.getReport())
                .ensemble(ensemble)
                .adapterForecasts(Collections.unmodifiableMap(adapterForecasts))
                .rankedMetrics(List.copyOf(ranked))
                .bestModel(ranked.isEmpty() ? null : ranked.get(0).getVariant())
                .anomalies(report)
                .diagnostics(List.copyOf(diagnostics))
                .build();
    }

    private static AnomalyReport join(CompletableFuture<AnomalyReport> anomalies) {
        try {
            return anomalies.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof WeatherInsightException wie) {
                throw wie;
            }
            throw new AnomalyDetectionUnavailableException("Anomaly detection failed: " + e.getCause());
        } catch (CancellationException e) {
            throw new AnomalyDetectionUnavailableException("Anomaly detection was cancelled");
        }
    }

    /**
     * Fill every unset option of the request from the properties
     */
    ResolvedRequest resolve(InsightRequest request) {
        WeatherInsightProperties.ForecastConfig forecast = properties.getForecast();

        List<String> modelIds = request.getModels().isEmpty() ? forecast.getModels() : request.getModels();
        int horizon = request.getHorizon() != null ? request.getHorizon() : forecast.getHorizon();
        Set<Integer> periods = request.getSeasonalPeriods() != null
                ? request.getSeasonalPeriods() : new HashSet<>(forecast.getSeasonalPeriods());

        Map<ModelVariant, Map<String, Double>> hyper = new EnumMap<>(ModelVariant.class);
        request.getHyperparameters().forEach((id, values) -> hyper.put(ModelVariant.fromId(id), values));

        List<ModelConfig> models = new ArrayList<>();
        for (String id : modelIds) {
            ModelVariant variant = ModelVariant.fromId(id);
            Map<String, Double> parameters = new TreeMap<>();
            parameters.put(PredictionIntervals.CONFIDENCE_LEVEL, forecast.getConfidenceLevel());
            if (hyper.get(variant) != null) {
                parameters.putAll(hyper.get(variant));
            }
            models.add(ModelConfig.builder()
                    .variant(variant)
                    .seasonalPeriods(periods)
                    .horizon(horizon)
                    .holidayCalendar(request.getHolidayCalendar())
                    .hyperparameters(parameters)
                    .build());
        }

        AnomalyConfig.AnomalyConfigBuilder anomaly = AnomalyConfig.fromProperties(properties).toBuilder();
        if (!request.getDetectors().isEmpty()) {
            Set<DetectorType> enabled = EnumSet.noneOf(DetectorType.class);
            request.getDetectors().forEach(id -> enabled.add(AnomalyConfig.detectorType(id)));
            anomaly.detectors(enabled);
        }
        if (!request.getDetectorWeights().isEmpty()) {
            Map<DetectorType, Double> weights = new EnumMap<>(DetectorType.class);
            weights.putAll(AnomalyConfig.fromProperties(properties).getWeights());
            request.getDetectorWeights().forEach((id, w) -> weights.put(AnomalyConfig.detectorType(id), w));
            anomaly.weights(Collections.unmodifiableMap(weights));
        }
        if (request.getDynamicThresholdZ() != null) {
            anomaly.thresholdZ(request.getDynamicThresholdZ());
        }

        List<String> anomalyVariables = request.getAnomalyVariables().isEmpty()
                ? request.getSeries().getVariables() : request.getAnomalyVariables();

        return new ResolvedRequest(
                request.getSeries().getSeriesId(),
                request.getVariable(),
                List.copyOf(models),
                request.getCvFolds() != null ? request.getCvFolds() : forecast.getCvFolds(),
                request.getPerModelTimeoutSeconds() != null
                        ? request.getPerModelTimeoutSeconds() : forecast.getPerModelTimeoutSeconds(),
                request.getMaxSeriesLengthForSequenceModel() != null
                        ? request.getMaxSeriesLengthForSequenceModel() : forecast.getMaxSeriesLengthForSequenceModel(),
                anomaly.build(),
                List.copyOf(anomalyVariables),
                request.getAsOf() == null ? null : request.getAsOf().toString(),
                request.isIncludeAdapterForecasts());
    }
}
