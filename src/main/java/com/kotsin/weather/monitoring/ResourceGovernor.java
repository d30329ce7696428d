package com.kotsin.weather.monitoring;

import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.exception.ResourceExhaustedException;
import com.kotsin.weather.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ResourceGovernor - admission control on the aggregate working set of in-flight requests.
 *
 * Each request reserves its estimated working set before any fitting starts and releases it when done
 * (try-with-resources on {@link Reservation}). A reservation is refused when it would exceed the
 * configured budget or when the JVM heap is already above the reject ratio.
 */
@Component
@Slf4j
public class ResourceGovernor {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    /**
     * Working-set multiplier per point and variable: adapter design matrices, folds and detector buffers
     */
    private static final int MODEL_FACTOR = 64;
    private static final int DETECTOR_FACTOR = 8;

    private final WeatherInsightProperties.GovernorConfig config;
    private final PipelineMetrics metrics;
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final AtomicLong reservedBytes = new AtomicLong(0);

    public ResourceGovernor(WeatherInsightProperties properties, PipelineMetrics metrics) {
        this.config = properties.getGovernor();
        this.metrics = metrics;
    }

    /**
     * Reservation handle; closing it twice releases once.
     */
    public final class Reservation implements AutoCloseable {
        private final long bytes;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Reservation(long bytes) {
            this.bytes = bytes;
        }

        public long getBytes() {
            return bytes;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                reservedBytes.addAndGet(-bytes);
            }
        }
    }

    /**
     * Rough working-set estimate of one request in bytes
     */
    public long estimateBytes(int points, int variables, int models, int detectors) {
        long cells = (long) points * Math.max(1, variables);
        return cells * Double.BYTES * ((long) models * MODEL_FACTOR + (long) detectors * DETECTOR_FACTOR + 1);
    }

    /**
     * Reserve working-set memory for a request.
     *
     * @throws ResourceExhaustedException when the budget or the heap cannot take the request
     */
    public Reservation reserve(String requestId, long bytes) {
        long budget = config.getMemoryBudgetMb() * BYTES_PER_MB;
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        if (heap.getMax() > 0) {
            double heapRatio = (double) heap.getUsed() / heap.getMax();
            if (heapRatio > config.getHeapRejectRatio()) {
                metrics.incGovernorRejection();
                log.warn("[GOVERNOR] Rejecting {}: heap usage {}% above {}%", requestId,
                        String.format("%.1f", heapRatio * 100), String.format("%.1f", config.getHeapRejectRatio() * 100));
                throw new ResourceExhaustedException(String.format(
                        "Heap usage %.1f%% too high to admit request %s", heapRatio * 100, requestId),
                        bytes, Math.max(0, heap.getMax() - heap.getUsed()));
            }
        }
        while (true) {
            long current = reservedBytes.get();
            if (current + bytes > budget) {
                metrics.incGovernorRejection();
                log.warn("[GOVERNOR] Rejecting {}: needs {}MB, {}MB of {}MB in use", requestId,
                        bytes / BYTES_PER_MB, current / BYTES_PER_MB, budget / BYTES_PER_MB);
                throw new ResourceExhaustedException(String.format(
                        "Request %s needs %d bytes; %d of %d bytes already reserved", requestId, bytes, current, budget),
                        bytes, Math.max(0, budget - current));
            }
            if (reservedBytes.compareAndSet(current, current + bytes)) {
                log.debug("[GOVERNOR] Reserved {} bytes for {} (in flight {})", bytes, requestId, current + bytes);
                return new Reservation(bytes);
            }
        }
    }

    /**
     * Refuse a sequence-learning fit on a series longer than the configured cap.
     */
    public void checkSequenceModel(int seriesLength, int maxLength) {
        if (seriesLength > maxLength) {
            metrics.incGovernorRejection();
            throw new ResourceExhaustedException(String.format(
                    "Sequence-learning fit on %d points exceeds the limit of %d", seriesLength, maxLength),
                    estimateBytes(seriesLength, 1, 1, 0), estimateBytes(maxLength, 1, 1, 0));
        }
    }

    public long getReservedBytes() {
        return reservedBytes.get();
    }
}
