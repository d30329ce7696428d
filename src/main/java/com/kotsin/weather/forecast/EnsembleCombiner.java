package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ForecastPoint;
import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.ValidationMetric;
import com.kotsin.weather.exception.EnsembleUnavailableException;
import com.kotsin.weather.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * EnsembleCombiner - inverse-error weighted combination of the surviving adapters.
 *
 * weight_i = (1 / error_i) / sum(1 / error_j). Adapters with zero validation error share the whole weight
 * equally. The ensemble half-width at each date is sqrt((W/2)^2 + V), where W is the weighted mean of
 * the adapter interval widths and V the weighted variance of their point estimates, and never less than
 * half the narrowest adapter width.
 */
@Component
@Slf4j
public class EnsembleCombiner {

    public static final String SOURCE = "ensemble";

    /**
     * Normalized weights from validation errors; sums to one for a non-empty input
     */
    public Map<ModelVariant, Double> weights(Map<ModelVariant, ValidationMetric> metrics) {
        Map<ModelVariant, Double> weights = new EnumMap<>(ModelVariant.class);
        List<ModelVariant> perfect = new ArrayList<>();
        List<ModelVariant> unusable = new ArrayList<>();
        double inverseSum = 0;
        for (Map.Entry<ModelVariant, ValidationMetric> e : metrics.entrySet()) {
            double error = e.getValue().getMae();
            if (!Double.isFinite(error)) {
                unusable.add(e.getKey());
            } else if (error <= MathUtils.EPSILON) {
                perfect.add(e.getKey());
            } else {
                inverseSum += 1.0 / error;
            }
        }

        if (!perfect.isEmpty()) {
            metrics.keySet().forEach(v -> weights.put(v, perfect.contains(v) ? 1.0 / perfect.size() : 0.0));
        } else if (inverseSum > 0) {
            for (Map.Entry<ModelVariant, ValidationMetric> e : metrics.entrySet()) {
                double error = e.getValue().getMae();
                weights.put(e.getKey(), unusable.contains(e.getKey()) ? 0.0 : (1.0 / error) / inverseSum);
            }
        } else {
            metrics.keySet().forEach(v -> weights.put(v, 1.0 / metrics.size()));
        }
        return weights;
    }

    /**
     * Combine the forecasts of the surviving adapters.
     *
     * @throws EnsembleUnavailableException when no adapter survived
     */
    public EnsembleForecast combine(Map<ModelVariant, ForecastResult> forecasts,
                                    Map<ModelVariant, ValidationMetric> metrics) {
        if (forecasts.isEmpty()) {
            throw new EnsembleUnavailableException("No forecasting model fitted successfully");
        }
        if (forecasts.size() == 1) {
            Map.Entry<ModelVariant, ForecastResult> only = forecasts.entrySet().iterator().next();
            log.warn("[ENSEMBLE] Only {} survived; ensemble is its forecast (low confidence)", only.getKey().getId());
            Map<ModelVariant, Double> weights = new EnumMap<>(ModelVariant.class);
            weights.put(only.getKey(), 1.0);
            return new EnsembleForecast(new ForecastResult(SOURCE, only.getValue().getPoints()), weights, true);
        }

        Map<ModelVariant, ValidationMetric> scored = new EnumMap<>(ModelVariant.class);
        forecasts.keySet().forEach(v -> scored.put(v, metrics.get(v)));
        Map<ModelVariant, Double> weights = weights(scored);

        int horizon = forecasts.values().iterator().next().horizon();
        for (Map.Entry<ModelVariant, ForecastResult> e : forecasts.entrySet()) {
            if (e.getValue().horizon() != horizon) {
                throw new IllegalArgumentException("Adapter " + e.getKey().getId() + " forecast has horizon "
                        + e.getValue().horizon() + ", expected " + horizon);
            }
        }

        List<ForecastPoint> points = new ArrayList<>(horizon);
        ForecastResult reference = forecasts.values().iterator().next();
        for (int h = 0; h < horizon; h++) {
            double point = 0;
            double meanWidth = 0;
            double minWidth = Double.POSITIVE_INFINITY;
            for (Map.Entry<ModelVariant, ForecastResult> e : forecasts.entrySet()) {
                ForecastPoint p = e.getValue().getPoints().get(h);
                double w = weights.get(e.getKey());
                point += w * p.getPoint();
                meanWidth += w * p.width();
                minWidth = Math.min(minWidth, p.width());
            }
            double spread = 0;
            for (Map.Entry<ModelVariant, ForecastResult> e : forecasts.entrySet()) {
                double diff = e.getValue().getPoints().get(h).getPoint() - point;
                spread += weights.get(e.getKey()) * diff * diff;
            }
            double half = Math.max(Math.sqrt(meanWidth * meanWidth / 4.0 + spread), minWidth / 2.0);
            points.add(new ForecastPoint(reference.getPoints().get(h).getDate(), point, point - half, point + half));
        }

        log.info("[ENSEMBLE] Combined {} adapters: weights={}", forecasts.size(), format(weights));
        return new EnsembleForecast(new ForecastResult(SOURCE, points), weights, false);
    }

    private static String format(Map<ModelVariant, Double> weights) {
        StringBuilder sb = new StringBuilder("{");
        weights.forEach((v, w) -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(v.getId()).append('=').append(String.format("%.3f", w));
        });
        return sb.append('}').toString();
    }
}
