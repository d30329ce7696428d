package com.kotsin.weather.anomaly;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DynamicThresholdEngine - trailing mean plus z standard deviations")
class DynamicThresholdEngineTest {

    private DynamicThresholdEngine engine;
    private AnomalyConfig config;

    @BeforeEach
    void setUp() {
        engine = new DynamicThresholdEngine();
        config = AnomalyConfig.builder()
                .thresholdWindow(5)
                .thresholdZ(2.0)
                .coldStartSamples(3)
                .fallbackThreshold(0.7)
                .build();
    }

    // ========== Cold Start Tests ==========

    @Test
    @DisplayName("Fallback threshold is used until enough severities are seen")
    void testColdStart() {
        ThresholdState state = engine.newState("temperature", config);

        assertEquals(0.7, engine.threshold(state), 1e-12);
        engine.observe(state, 0.1);
        engine.observe(state, 0.2);
        assertEquals(0.7, engine.threshold(state), 1e-12);
        assertFalse(state.isDynamic());

        engine.observe(state, 0.3);
        assertEquals(0.2 + 2.0 * 0.1, engine.threshold(state), 1e-12);
        assertTrue(state.isDynamic());
    }

    @Test
    @DisplayName("Non-finite severities are ignored")
    void testIgnoresNaN() {
        ThresholdState state = engine.newState("temperature", config);
        engine.observe(state, Double.NaN);
        engine.observe(state, Double.POSITIVE_INFINITY);

        assertEquals(0, state.getSamples());
        assertEquals(0.7, engine.threshold(state), 1e-12);
    }

    // ========== Window Tests ==========

    @Test
    @DisplayName("Only the trailing window contributes")
    void testTrailingWindow() {
        ThresholdState state = engine.newState("temperature", config);
        engine.observe(state, 0.9);
        for (int i = 0; i < 5; i++) {
            engine.observe(state, 0.2);
        }

        assertEquals(0.2, engine.threshold(state), 1e-12);
    }

    @Test
    @DisplayName("Threshold grows with the spread of recent severities")
    void testMonotonicInSpread() {
        double narrow = DynamicThresholdEngine.compute(new double[]{0.4, 0.5, 0.6}, 2.5);
        double wide = DynamicThresholdEngine.compute(new double[]{0.2, 0.5, 0.8}, 2.5);
        double wider = DynamicThresholdEngine.compute(new double[]{0.0, 0.5, 1.0}, 2.5);

        assertTrue(narrow < wide);
        assertTrue(wide < wider);
    }

    @Test
    @DisplayName("Empty window has no threshold")
    void testEmptyWindow() {
        assertTrue(Double.isNaN(DynamicThresholdEngine.compute(new double[0], 2.5)));
    }
}
