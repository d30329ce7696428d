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
 * Modified z-score 0.6745 * |x - median| / MAD over a trailing window.
 * When the MAD is zero the mean absolute deviation (scaled by 1.2533) is used instead.
 */
@Component
public class ModifiedZScoreDetector implements AnomalyDetector {

    private static final double MAD_CONSTANT = 0.6745;
    private static final double MEAN_AD_CONSTANT = 1.253314;

    @Override
    public DetectorType getType() {
        return DetectorType.MODIFIED_Z_SCORE;
    }

    @Override
    public DetectorScores score(DetectorInput input, AnomalyConfig config, DetectorState state) {
        double[] x = input.getValues();
        double[] raw = new double[x.length];
        RollingWindow window = state.window(getType(), config.getModifiedZscoreWindow());
        window.clear();
        int minHistory = TrailingWindowSupport.minHistory(config.getModifiedZscoreWindow());

        for (int t = 0; t < x.length; t++) {
            if (window.size() < minHistory) {
                raw[t] = Double.NaN;
            } else {
                double[] history = window.values();
                double median = MathUtils.median(history);
                double mad = MathUtils.mad(history);
                if (MathUtils.isValidDenominator(mad)) {
                    raw[t] = MAD_CONSTANT * Math.abs(x[t] - median) / mad;
                } else {
                    double meanAd = 0;
                    for (double v : history) {
                        meanAd += Math.abs(v - median);
                    }
                    meanAd /= history.length;
                    raw[t] = TrailingWindowSupport.ratio(x[t] - median, MEAN_AD_CONSTANT * meanAd);
                }
            }
            window.add(x[t]);
        }
        return new DetectorScores(getType(), raw, config.getModifiedZscoreThreshold());
    }
}
