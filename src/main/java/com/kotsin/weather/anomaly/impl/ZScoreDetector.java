package com.kotsin.weather.anomaly.impl;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.anomaly.AnomalyDetector;
import com.kotsin.weather.anomaly.DetectorInput;
import com.kotsin.weather.anomaly.DetectorScores;
import com.kotsin.weather.anomaly.DetectorState;
import com.kotsin.weather.anomaly.RollingWindow;
import com.kotsin.weather.domain.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Z-score against the rolling mean and standard deviation of the preceding points.
 */
@Component
public class ZScoreDetector implements AnomalyDetector {

    @Override
    public DetectorType getType() {
        return DetectorType.Z_SCORE;
    }

    @Override
    public DetectorScores score(DetectorInput input, AnomalyConfig config, DetectorState state) {
        double[] x = input.getValues();
        double[] raw = new double[x.length];
        RollingWindow window = state.window(getType(), config.getZscoreWindow());
        window.clear();
        int minHistory = TrailingWindowSupport.minHistory(config.getZscoreWindow());

        for (int t = 0; t < x.length; t++) {
            raw[t] = window.size() < minHistory
                    ? Double.NaN
                    : TrailingWindowSupport.ratio(x[t] - window.mean(), window.std());
            window.add(x[t]);
        }
        return new DetectorScores(getType(), raw, config.getZscoreThreshold());
    }
}
