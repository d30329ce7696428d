package com.kotsin.weather.support;

import com.kotsin.weather.config.AsyncConfig;
import com.kotsin.weather.domain.model.TimeSeries;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.LocalDate;
import java.util.Random;

/**
 * Deterministic test series and executors shared by the unit tests.
 */
public final class SeriesFixtures {

    public static final LocalDate START = LocalDate.of(2020, 1, 1);
    public static final String TEMPERATURE = "temperature";

    private SeriesFixtures() {}

    /**
     * Daily temperature-like values: level 15, slight trend, weekly and yearly cycles, Gaussian noise
     */
    public static double[] seasonal(int n, long seed, double noise) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = 15.0 + 0.002 * t
                    + 1.5 * Math.sin(2 * Math.PI * t / 7.0)
                    + 8.0 * Math.sin(2 * Math.PI * t / 365.0)
                    + noise * random.nextGaussian();
        }
        return values;
    }

    /**
     * Stationary values around {@code level} with unit-variance Gaussian noise
     */
    public static double[] stable(int n, long seed, double level) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = level + random.nextGaussian();
        }
        return values;
    }

    public static TimeSeries series(String id, double[] values) {
        return TimeSeries.daily(id, TEMPERATURE, START, values);
    }

    public static ThreadPoolTaskExecutor executor(String name, int poolSize) {
        return AsyncConfig.build(name.toUpperCase(), name + "-", poolSize, 100);
    }

    /**
     * Model pool that rejects submissions once its queue is full
     */
    public static ThreadPoolTaskExecutor modelExecutor(String name, int poolSize, int queueCapacity) {
        return AsyncConfig.build(name.toUpperCase(), name + "-", poolSize, queueCapacity, false);
    }
}
