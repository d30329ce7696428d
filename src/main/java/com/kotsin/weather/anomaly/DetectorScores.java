package com.kotsin.weather.anomaly;

import com.kotsin.weather.domain.model.DetectorType;
import lombok.Value;

/**
 * Raw per-point statistic of one detector; {@code NaN} where the detector has no opinion (e.g. warm-up).
 */
@Value
public class DetectorScores {
    DetectorType type;
    double[] raw;
    double cutoff;

    public double normalized(int index) {
        return ScoreNormalizer.normalize(raw[index], cutoff);
    }

    public boolean exceeds(int index) {
        return ScoreNormalizer.exceeds(raw[index], cutoff);
    }
}
