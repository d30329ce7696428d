package com.kotsin.weather.anomaly;

import com.kotsin.weather.util.MathUtils;

import java.util.Arrays;

/**
 * Fixed-capacity ring buffer of the most recent values. Not thread-safe.
 */
public class RollingWindow {

    private final double[] buffer;
    private int start;
    private int size;

    public RollingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.buffer = new double[capacity];
    }

    public void add(double value) {
        if (size < buffer.length) {
            buffer[(start + size) % buffer.length] = value;
            size++;
        } else {
            buffer[start] = value;
            start = (start + 1) % buffer.length;
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }

    public boolean isFull() {
        return size == buffer.length;
    }

    /**
     * Values oldest first
     */
    public double[] values() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = buffer[(start + i) % buffer.length];
        }
        return out;
    }

    public double[] sortedValues() {
        double[] out = values();
        Arrays.sort(out);
        return out;
    }

    public double mean() {
        return MathUtils.mean(values());
    }

    /**
     * Sample standard deviation
     */
    public double std() {
        return MathUtils.std(values());
    }

    public void clear() {
        start = 0;
        size = 0;
    }
}
