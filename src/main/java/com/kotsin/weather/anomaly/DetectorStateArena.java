package com.kotsin.weather.anomaly;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-request owner of the detector states, indexed by variable. Discarded when the request ends;
 * there is no process-wide registry of detector state.
 */
@Slf4j
public class DetectorStateArena {

    private final Map<String, DetectorState> states = new ConcurrentHashMap<>();

    /**
     * State of a variable; a state left over from a different series is replaced by a fresh one.
     */
    public DetectorState stateFor(String seriesId, String variable) {
        return states.compute(variable, (k, existing) -> {
            if (existing != null && existing.getSeriesId().equals(seriesId)) {
                return existing;
            }
            if (existing != null) {
                log.debug("[ANOMALY] Series changed for {} ({} -> {}), resetting detector state",
                        variable, existing.getSeriesId(), seriesId);
            }
            return new DetectorState(seriesId, variable);
        });
    }

    public int size() {
        return states.size();
    }
}
