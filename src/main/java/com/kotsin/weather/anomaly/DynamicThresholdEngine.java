package com.kotsin.weather.anomaly;

import com.kotsin.weather.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * DynamicThresholdEngine - detection threshold from the trailing distribution of fused severities.
 *
 * threshold = mean + z * std over the last {@code window} severities of the variable. Until
 * {@code coldStartSamples} severities have been seen the conservative fallback is used; after that the
 * dynamic value is used permanently. The threshold for a point only depends on earlier points.
 */
@Component
@Slf4j
public class DynamicThresholdEngine {

    public ThresholdState newState(String variable, AnomalyConfig config) {
        return new ThresholdState(variable, config.getThresholdWindow(), config.getThresholdZ(),
                config.getColdStartSamples(), config.getFallbackThreshold());
    }

    /**
     * Current threshold of a variable
     */
    public double threshold(ThresholdState state) {
        if (!state.isDynamic() && state.getSamples() >= state.getColdStartSamples()) {
            state.switchToDynamic();
            log.debug("[THRESHOLD] {} switched to dynamic threshold after {} samples",
                    state.getVariable(), state.getSamples());
        }
        if (!state.isDynamic()) {
            return state.getFallback();
        }
        return compute(state.getWindow().values(), state.getZ());
    }

    /**
     * Record the fused severity of the point just evaluated; non-finite severities are ignored
     */
    public void observe(ThresholdState state, double severity) {
        if (Double.isFinite(severity)) {
            state.record(severity);
        }
    }

    /**
     * mean + z * sample std of the window
     */
    public static double compute(double[] window, double z) {
        double mean = MathUtils.mean(window);
        double std = MathUtils.std(window);
        if (Double.isNaN(mean)) {
            return Double.NaN;
        }
        return mean + z * (Double.isNaN(std) ? 0.0 : std);
    }
}
