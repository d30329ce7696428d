package com.kotsin.weather.anomaly;

import com.kotsin.weather.domain.model.DetectorType;
import lombok.Getter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling statistics of the detectors for one (series, variable) pair.
 *
 * Each detector owns its own window inside the state, so the detectors of one variable can run
 * concurrently without sharing a buffer. States are created per request by {@link DetectorStateArena}.
 */
@Getter
public class DetectorState {

    private final String seriesId;
    private final String variable;
    private final Map<DetectorType, RollingWindow> windows = new ConcurrentHashMap<>();

    public DetectorState(String seriesId, String variable) {
        this.seriesId = seriesId;
        this.variable = variable;
    }

    /**
     * Window of a detector, created empty on first use. Asking again with another capacity resets it.
     */
    public RollingWindow window(DetectorType type, int capacity) {
        return windows.compute(type, (k, existing) ->
                existing != null && existing.capacity() == capacity ? existing : new RollingWindow(capacity));
    }

    public void reset() {
        windows.values().forEach(RollingWindow::clear);
    }
}
