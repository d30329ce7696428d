package com.kotsin.weather.metrics;

import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.forecast.ModelStatus;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters of the insight pipeline.
 */
@Component
public class PipelineMetrics {
    private final Map<String, AtomicLong> modelOutcomes = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> detectorFailures = new ConcurrentHashMap<>();
    private final AtomicLong requests = new AtomicLong(0);
    private final AtomicLong terminalFailures = new AtomicLong(0);
    private final AtomicLong flagsEmitted = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicLong governorRejections = new AtomicLong(0);

    public void incModelOutcome(ModelVariant variant, ModelStatus status) {
        modelOutcomes.computeIfAbsent(variant.getId() + ":" + status, k -> new AtomicLong()).incrementAndGet();
    }
    public void incDetectorFailure(DetectorType type) { detectorFailures.computeIfAbsent(type.getId(), k -> new AtomicLong()).incrementAndGet(); }
    public void incRequest() { requests.incrementAndGet(); }
    public void incTerminalFailure() { terminalFailures.incrementAndGet(); }
    public void addFlags(int count) { flagsEmitted.addAndGet(count); }
    public void incCacheHit() { cacheHits.incrementAndGet(); }
    public void incCacheMiss() { cacheMisses.incrementAndGet(); }
    public void incGovernorRejection() { governorRejections.incrementAndGet(); }

    public long getModelOutcomes(ModelVariant variant, ModelStatus status) {
        AtomicLong v = modelOutcomes.get(variant.getId() + ":" + status);
        return v == null ? 0 : v.get();
    }
    public Map<String, Long> getModelOutcomes() { return toLongMap(modelOutcomes); }
    public Map<String, Long> getDetectorFailures() { return toLongMap(detectorFailures); }
    public long getRequests() { return requests.get(); }
    public long getTerminalFailures() { return terminalFailures.get(); }
    public long getFlagsEmitted() { return flagsEmitted.get(); }
    public long getCacheHits() { return cacheHits.get(); }
    public long getCacheMisses() { return cacheMisses.get(); }
    public long getGovernorRejections() { return governorRejections.get(); }

    public String getSummary() {
        return String.format("requests=%d terminalFailures=%d flags=%d cacheHits=%d cacheMisses=%d rejections=%d models=%s",
                getRequests(), getTerminalFailures(), getFlagsEmitted(), getCacheHits(), getCacheMisses(),
                getGovernorRejections(), getModelOutcomes());
    }

    private Map<String, Long> toLongMap(Map<String, AtomicLong> src) {
        Map<String, Long> out = new TreeMap<>();
        src.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }
}
