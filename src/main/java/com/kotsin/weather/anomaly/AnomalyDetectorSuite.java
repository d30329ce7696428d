package com.kotsin.weather.anomaly;

import com.kotsin.weather.domain.model.AlertLevel;
import com.kotsin.weather.domain.model.AnomalyFlag;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.domain.model.Diagnostic;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.exception.AnomalyDetectionUnavailableException;
import com.kotsin.weather.exception.WeatherInsightException;
import com.kotsin.weather.metrics.PipelineMetrics;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * AnomalyDetectorSuite - runs the enabled detectors per variable and fuses their scores.
 *
 * Every (variable, detector) pair is an independent task on the detector pool. A failing detector is
 * recorded as a diagnostic and left out of the fusion for that variable. The fusion is the weighted mean of
 * the normalized scores of the detectors that have an opinion at a point; the point is flagged when the
 * fused severity exceeds the dynamic threshold of its variable, evaluated strictly in date order.
 */
@Component
@Slf4j
public class AnomalyDetectorSuite {

    private final Map<DetectorType, AnomalyDetector> detectors;
    private final DynamicThresholdEngine thresholdEngine;
    private final PipelineMetrics metrics;
    private final AsyncTaskExecutor detectorExecutor;

    public AnomalyDetectorSuite(List<AnomalyDetector> detectors,
                                DynamicThresholdEngine thresholdEngine,
                                PipelineMetrics metrics,
                                @Qualifier("detectorExecutor") AsyncTaskExecutor detectorExecutor) {
        Map<DetectorType, AnomalyDetector> byType = new EnumMap<>(DetectorType.class);
        for (AnomalyDetector detector : detectors) {
            byType.put(detector.getType(), detector);
        }
        this.detectors = Collections.unmodifiableMap(byType);
        this.thresholdEngine = thresholdEngine;
        this.metrics = metrics;
        this.detectorExecutor = detectorExecutor;
        log.info("[ANOMALY] Registered detectors: {}", byType.keySet());
    }

    /**
     * Result of one detector task
     */
    @Value
    private static class DetectorRun {
        String variable;
        DetectorType type;
        DetectorScores scores;
        Throwable failure;
    }

    /**
     * Start detection without blocking the caller.
     *
     * @param modelInput complete series the detectors score
     * @param raw        series as supplied, used to tell observed points from imputed ones
     * @param variables  variables to scan
     * @param config     detector configuration
     * @param arena      per-request detector state
     */
    public CompletableFuture<AnomalyReport> detectAsync(TimeSeries modelInput, TimeSeries raw, List<String> variables,
                                                        AnomalyConfig config, DetectorStateArena arena) {
        List<CompletableFuture<DetectorRun>> tasks = new ArrayList<>();
        Map<String, DetectorInput> inputs = new LinkedHashMap<>();

        // each variable once
        for (String variable : new LinkedHashSet<>(variables)) {
            DetectorInput input = input(modelInput, raw, variable);
            inputs.put(variable, input);
            DetectorState state = arena.stateFor(modelInput.getSeriesId(), variable);
            for (Map.Entry<DetectorType, AnomalyDetector> entry : detectors.entrySet()) {
                DetectorType type = entry.getKey();
                if (!config.isEnabled(type) || config.weight(type) <= 0) {
                    continue;
                }
                AnomalyDetector detector = entry.getValue();
                tasks.add(CompletableFuture
                        .supplyAsync(() -> detector.score(input, config, state), detectorExecutor)
                        .handle((scores, error) -> new DetectorRun(variable, type, scores, unwrap(error))));
            }
        }

        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> fuse(inputs,
                        tasks.stream().map(CompletableFuture::join).collect(Collectors.toList()), config));
    }

    /**
     * Blocking variant of {@link #detectAsync}
     */
    public AnomalyReport detect(TimeSeries modelInput, TimeSeries raw, List<String> variables, AnomalyConfig config,
                                DetectorStateArena arena) {
        try {
            return detectAsync(modelInput, raw, variables, config, arena).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnomalyDetectionUnavailableException("Interrupted while waiting for detectors");
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new AnomalyDetectionUnavailableException("Detection failed: " + cause);
        }
    }

    private AnomalyReport fuse(Map<String, DetectorInput> inputs, List<DetectorRun> runs, AnomalyConfig config) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<DetectorType> ran = EnumSet.noneOf(DetectorType.class);
        Map<String, List<DetectorScores>> byVariable = new LinkedHashMap<>();
        inputs.keySet().forEach(v -> byVariable.put(v, new ArrayList<>()));

        for (DetectorRun run : runs) {
            if (run.getFailure() != null) {
                Throwable f = run.getFailure();
                String code = f instanceof WeatherInsightException wie ? wie.getErrorCode() : null;
                diagnostics.add(Diagnostic.detector(run.getType(), code, run.getVariable() + ": " + f.getMessage()));
                metrics.incDetectorFailure(run.getType());
                log.warn("[ANOMALY] {} failed on {}: {}", run.getType().getId(), run.getVariable(), f.getMessage());
            } else {
                ran.add(run.getType());
                byVariable.get(run.getVariable()).add(run.getScores());
            }
        }
        if (ran.isEmpty()) {
            throw new AnomalyDetectionUnavailableException(String.format(
                    "No detector produced scores for %s (%d failures)", inputs.keySet(), diagnostics.size()));
        }

        List<AnomalyFlag> flags = new ArrayList<>();
        Map<String, Double> finalThresholds = new LinkedHashMap<>();
        Map<String, double[]> severities = new LinkedHashMap<>();
        for (Map.Entry<String, DetectorInput> entry : inputs.entrySet()) {
            String variable = entry.getKey();
            List<DetectorScores> scores = byVariable.get(variable);
            if (scores.isEmpty()) {
                diagnostics.add(Diagnostic.warning("anomaly:" + variable, "No detector produced scores"));
                continue;
            }
            scores.sort(Comparator.comparing(DetectorScores::getType));
            ThresholdState state = thresholdEngine.newState(variable, config);
            double[] fused = flagVariable(entry.getValue(), scores, config, state, flags);
            severities.put(variable, fused);
            finalThresholds.put(variable, thresholdEngine.threshold(state));
        }

        flags.sort(Comparator.comparing(AnomalyFlag::getDate).thenComparing(AnomalyFlag::getVariable));
        metrics.addFlags(flags.size());
        log.info("[ANOMALY] {} variables scanned by {} detectors, {} flags, {} detector failures",
                inputs.size(), ran.size(), flags.size(), diagnostics.size());
        return new AnomalyReport(List.copyOf(flags), finalThresholds, severities, List.copyOf(ran),
                List.copyOf(diagnostics));
    }

    private double[] flagVariable(DetectorInput input, List<DetectorScores> scores, AnomalyConfig config,
                                  ThresholdState state, List<AnomalyFlag> flags) {
        int n = input.size();
        double[] fused = new double[n];
        for (int t = 0; t < n; t++) {
            fused[t] = fusedSeverity(scores, config, t);
            if (Double.isNaN(fused[t])) {
                continue;
            }
            double threshold = thresholdEngine.threshold(state);
            if (input.getObserved()[t] && fused[t] > threshold) {
                List<DetectorType> contributors = new ArrayList<>();
                for (DetectorScores s : scores) {
                    if (s.exceeds(t)) {
                        contributors.add(s.getType());
                    }
                }
                flags.add(AnomalyFlag.builder()
                        .date(input.getDates().get(t))
                        .variable(input.getVariable())
                        .value(input.getValues()[t])
                        .severity(fused[t])
                        .contributors(List.copyOf(contributors))
                        .threshold(threshold)
                        .level(AlertLevel.fromSeverity(fused[t]))
                        .build());
            }
            thresholdEngine.observe(state, fused[t]);
        }
        return fused;
    }

    /**
     * Weighted mean of the normalized scores that are defined at {@code t}
     */
    static double fusedSeverity(List<DetectorScores> scores, AnomalyConfig config, int t) {
        double sum = 0;
        double weight = 0;
        for (DetectorScores s : scores) {
            double normalized = s.normalized(t);
            if (Double.isNaN(normalized)) {
                continue;
            }
            double w = config.weight(s.getType());
            sum += w * normalized;
            weight += w;
        }
        return weight > 0 ? sum / weight : Double.NaN;
    }

    private static DetectorInput input(TimeSeries modelInput, TimeSeries raw, String variable) {
        double[] values = modelInput.values(variable);
        double[] rawValues = raw.hasVariable(variable) ? raw.values(variable) : values;
        boolean[] observed = new boolean[values.length];
        for (int t = 0; t < values.length; t++) {
            observed[t] = Double.isFinite(rawValues[t]) && Double.compare(rawValues[t], values[t]) == 0;
        }
        Map<String, double[]> covariates = new LinkedHashMap<>();
        for (String other : modelInput.getVariables()) {
            if (!other.equals(variable)) {
                covariates.put(other, modelInput.values(other));
            }
        }
        List<LocalDate> dates = modelInput.dates();
        return new DetectorInput(modelInput.getSeriesId(), variable, dates, values, observed, covariates);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
