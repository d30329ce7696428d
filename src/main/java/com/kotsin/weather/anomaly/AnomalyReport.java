package com.kotsin.weather.anomaly;

import com.kotsin.weather.domain.model.AnomalyFlag;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.domain.model.Diagnostic;
import lombok.Value;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fused anomaly output of one request. Immutable: reports are shared by every hit of the result cache.
 */
@Value
public class AnomalyReport {

    /**
     * Flags ordered by date, then variable
     */
    List<AnomalyFlag> flags;

    /**
     * Threshold in force after the last point, per variable
     */
    Map<String, Double> finalThresholds;

    /**
     * Fused severity of every point, per variable; NaN where no detector had an opinion
     */
    Map<String, double[]> severities;

    /**
     * Detectors that produced scores for at least one variable
     */
    List<DetectorType> detectorsRun;

    List<Diagnostic> diagnostics;

    public AnomalyReport(List<AnomalyFlag> flags, Map<String, Double> finalThresholds,
                         Map<String, double[]> severities, List<DetectorType> detectorsRun,
                         List<Diagnostic> diagnostics) {
        this.flags = List.copyOf(flags);
        this.finalThresholds = Collections.unmodifiableMap(new LinkedHashMap<>(finalThresholds));
        this.severities = copy(severities);
        this.detectorsRun = List.copyOf(detectorsRun);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Copy of the fused severities; changing it leaves the report untouched
     */
    public Map<String, double[]> getSeverities() {
        return copy(severities);
    }

    /**
     * Copy of the fused severities of one variable, or null when the variable was not scored
     */
    public double[] severitiesOf(String variable) {
        double[] values = severities.get(variable);
        return values == null ? null : values.clone();
    }

    private static Map<String, double[]> copy(Map<String, double[]> source) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        source.forEach((variable, values) -> copy.put(variable, values.clone()));
        return Collections.unmodifiableMap(copy);
    }

    public List<AnomalyFlag> flagsFor(String variable) {
        return flags.stream()
                .filter(f -> f.getVariable().equals(variable))
                .collect(Collectors.toList());
    }

    /**
     * Alerts ranked by level (HIGH first), then date
     */
    public List<AnomalyFlag> alertsByLevel() {
        return flags.stream()
                .sorted(Comparator.comparing(AnomalyFlag::getLevel)
                        .thenComparing(AnomalyFlag::getDate)
                        .thenComparing(AnomalyFlag::getVariable))
                .collect(Collectors.toList());
    }
}
