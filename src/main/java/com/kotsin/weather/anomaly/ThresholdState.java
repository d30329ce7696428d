package com.kotsin.weather.anomaly;

import lombok.Getter;

/**
 * Trailing fused severities of one variable and whether the threshold has left cold start.
 */
@Getter
public class ThresholdState {

    private final String variable;
    private final RollingWindow window;
    private final double z;
    private final int coldStartSamples;
    private final double fallback;
    private boolean dynamic;
    private long samples;

    ThresholdState(String variable, int window, double z, int coldStartSamples, double fallback) {
        this.variable = variable;
        this.window = new RollingWindow(window);
        this.z = z;
        this.coldStartSamples = coldStartSamples;
        this.fallback = fallback;
    }

    void record(double severity) {
        window.add(severity);
        samples++;
    }

    void switchToDynamic() {
        dynamic = true;
    }
}
