package com.kotsin.weather.cache;

import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.metrics.PipelineMetrics;
import com.kotsin.weather.service.InsightResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InsightResultCache - content and configuration keyed results")
class InsightResultCacheTest {

    private WeatherInsightProperties properties;
    private PipelineMetrics metrics;
    private InsightResultCache cache;

    @BeforeEach
    void setUp() {
        properties = new WeatherInsightProperties();
        metrics = new PipelineMetrics();
        cache = new InsightResultCache(properties, metrics);
        cache.init();
    }

    private static InsightResult result(String id) {
        return InsightResult.builder().requestId(id).seriesId("loc-1").variable("temperature").build();
    }

    // ========== Key Tests ==========

    @Test
    @DisplayName("Key ignores map ordering but not configuration values")
    void testKey() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("horizon", 7);
        a.put("models", "autoregressive");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("models", "autoregressive");
        b.put("horizon", 7);
        Map<String, Object> c = new LinkedHashMap<>(a);
        c.put("horizon", 14);

        assertEquals(cache.key("hash", a), cache.key("hash", b));
        assertNotEquals(cache.key("hash", a), cache.key("hash", c));
        assertNotEquals(cache.key("hash", a), cache.key("other", a));
        assertTrue(cache.key("hash", a).startsWith("hash:"));
    }

    // ========== Lookup Tests ==========

    @Test
    @DisplayName("Stored result is served until evicted and counted as hit or miss")
    void testPutAndGet() {
        assertTrue(cache.get("k").isEmpty());
        cache.put("k", result("r1"), null);

        assertEquals("r1", cache.get("k").orElseThrow().getRequestId());
        assertEquals(1, metrics.getCacheHits());
        assertEquals(1, metrics.getCacheMisses());

        cache.invalidateAll();
        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    @DisplayName("Zero expiry stores nothing")
    void testZeroExpiry() {
        cache.put("k", result("r1"), Duration.ZERO);

        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Entries expire after their own expiry")
    void testPerEntryExpiry() throws InterruptedException {
        cache.put("short", result("r1"), Duration.ofMillis(50));
        cache.put("long", result("r2"), Duration.ofMinutes(5));

        Thread.sleep(300);

        assertTrue(cache.get("short").isEmpty());
        assertTrue(cache.get("long").isPresent());
    }

    @Test
    @DisplayName("Disabled cache neither stores nor counts")
    void testDisabled() {
        properties.getCache().setEnabled(false);
        InsightResultCache disabled = new InsightResultCache(properties, metrics);
        disabled.init();

        disabled.put("k", result("r1"), null);

        assertTrue(disabled.get("k").isEmpty());
        assertEquals(0, metrics.getCacheMisses());
    }
}
