package com.kotsin.weather.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.exception.InvalidConfigException;
import com.kotsin.weather.metrics.PipelineMetrics;
import com.kotsin.weather.service.InsightResult;
import jakarta.annotation.PostConstruct;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * InsightResultCache - results keyed by (series content hash, configuration hash).
 *
 * Each entry expires after the expiry supplied with the request that produced it, or the configured
 * default. Reads and writes of different keys never block each other.
 */
@Component
@Slf4j
public class InsightResultCache {

    private static final ObjectMapper CONFIG_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final WeatherInsightProperties.CacheConfig config;
    private final PipelineMetrics metrics;
    private Cache<String, Entry> results;

    public InsightResultCache(WeatherInsightProperties properties, PipelineMetrics metrics) {
        this.config = properties.getCache();
        this.metrics = metrics;
    }

    @Value
    private static class Entry {
        InsightResult result;
        Duration expiry;
    }

    @PostConstruct
    public void init() {
        results = Caffeine.newBuilder()
                .maximumSize(config.getMaximumSize())
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.getExpiry().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.getExpiry().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
        log.info("[CACHE] Initialized: enabled={}, maximumSize={}, defaultExpiry={}min",
                config.isEnabled(), config.getMaximumSize(), config.getExpireAfterWriteMinutes());
    }

    /**
     * Cache key of a series and its resolved configuration
     */
    public String key(String contentHash, Object resolvedConfig) {
        try {
            byte[] json = CONFIG_MAPPER.writeValueAsBytes(resolvedConfig);
            return contentHash + ":" + DigestUtils.md5DigestAsHex(json);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigException("Configuration cannot be hashed: " + e.getOriginalMessage());
        }
    }

    public Optional<InsightResult> get(String key) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }
        Entry entry = results.getIfPresent(key);
        if (entry == null) {
            metrics.incCacheMiss();
            return Optional.empty();
        }
        metrics.incCacheHit();
        log.debug("[CACHE] Hit {}", key);
        return Optional.of(entry.getResult());
    }

    /**
     * Store a result; a zero expiry stores nothing
     */
    public void put(String key, InsightResult result, Duration expiry) {
        if (!config.isEnabled()) {
            return;
        }
        Duration ttl = expiry != null ? expiry : Duration.ofMinutes(config.getExpireAfterWriteMinutes());
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        results.put(key, new Entry(result, ttl));
    }

    public void invalidateAll() {
        results.invalidateAll();
    }

    public long size() {
        results.cleanUp();
        return results.estimatedSize();
    }
}
