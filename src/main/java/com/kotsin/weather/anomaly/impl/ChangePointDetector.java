package com.kotsin.weather.anomaly.impl;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.anomaly.AnomalyDetector;
import com.kotsin.weather.anomaly.DetectorInput;
import com.kotsin.weather.anomaly.DetectorScores;
import com.kotsin.weather.anomaly.DetectorState;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.util.MathUtils;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Two-window shift test at every point t: left window [t-w, t) against right window [t, t+w).
 *
 * raw = max(Welch t statistic of the means, |ln(scaleR / scaleL)| * sqrt(w / 2)) where the scales are
 * robust (MAD) so a single outlier does not look like a variance shift. Points without a full window on
 * both sides score NaN.
 */
@Component
public class ChangePointDetector implements AnomalyDetector {

    @Override
    public DetectorType getType() {
        return DetectorType.CHANGE_POINT;
    }

    @Override
    public DetectorScores score(DetectorInput input, AnomalyConfig config, DetectorState state) {
        double[] x = input.getValues();
        int n = x.length;
        int w = Math.max(3, config.getChangePointWindow());
        if (n < 2 * w + 1) {
            throw new InsufficientDataException(String.format(
                    "Change-point window %d needs %d points, got %d", w, 2 * w + 1, n), n, 2 * w + 1);
        }
        double[] raw = new double[n];
        Arrays.fill(raw, Double.NaN);
        double scaleFactor = Math.sqrt(w / 2.0);

        for (int t = w; t <= n - w; t++) {
            double[] left = Arrays.copyOfRange(x, t - w, t);
            double[] right = Arrays.copyOfRange(x, t, t + w);

            double meanShift = TrailingWindowSupport.ratio(MathUtils.mean(right) - MathUtils.mean(left),
                    Math.sqrt(MathUtils.variance(left) / w + MathUtils.variance(right) / w));

            double scaleL = MathUtils.mad(left);
            double scaleR = MathUtils.mad(right);
            double scaleShift = 0.0;
            if (MathUtils.isValidDenominator(scaleL) && MathUtils.isValidDenominator(scaleR)) {
                scaleShift = Math.abs(Math.log(scaleR / scaleL)) * scaleFactor;
            }
            raw[t] = Math.max(meanShift, scaleShift);
        }
        return new DetectorScores(getType(), raw, config.getChangePointThreshold());
    }
}
