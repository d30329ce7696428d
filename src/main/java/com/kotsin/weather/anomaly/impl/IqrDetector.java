package com.kotsin.weather.anomaly.impl;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.anomaly.AnomalyDetector;
import com.kotsin.weather.anomaly.DetectorInput;
import com.kotsin.weather.anomaly.DetectorScores;
import com.kotsin.weather.anomaly.DetectorState;
import com.kotsin.weather.anomaly.RollingWindow;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.util.MathUtils;
import org.springframework.stereotype.Component;

/**
 * Interquartile-range detector over a trailing window.
 *
 * raw = distance outside [Q1, Q3] in IQR units; a point is anomalous beyond Q1 - k*IQR or Q3 + k*IQR,
 * so the cutoff is k.
 */
@Component
public class IqrDetector implements AnomalyDetector {

    @Override
    public DetectorType getType() {
        return DetectorType.IQR;
    }

    @Override
    public DetectorScores score(DetectorInput input, AnomalyConfig config, DetectorState state) {
        double[] x = input.getValues();
        double[] raw = new double[x.length];
        RollingWindow window = state.window(getType(), config.getIqrWindow());
        window.clear();
        int minHistory = TrailingWindowSupport.minHistory(config.getIqrWindow());

        for (int t = 0; t < x.length; t++) {
            if (window.size() < minHistory) {
                raw[t] = Double.NaN;
            } else {
                double[] sorted = window.sortedValues();
                double q1 = MathUtils.sortedQuantile(sorted, 0.25);
                double q3 = MathUtils.sortedQuantile(sorted, 0.75);
                double outside = Math.max(0.0, Math.max(q1 - x[t], x[t] - q3));
                raw[t] = TrailingWindowSupport.ratio(outside, q3 - q1);
            }
            window.add(x[t]);
        }
        return new DetectorScores(getType(), raw, config.getIqrMultiplier());
    }
}
