package com.kotsin.weather.anomaly.impl;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.anomaly.AnomalyDetector;
import com.kotsin.weather.anomaly.DetectorInput;
import com.kotsin.weather.anomaly.DetectorScores;
import com.kotsin.weather.anomaly.DetectorState;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.exception.InsufficientDataException;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

/**
 * Isolation forest over the standardized value, its first difference and the covariates.
 *
 * Anomaly score s = 2^(-E[h(x)] / c(psi)); points that isolate in few random splits score close to 1,
 * the bulk scores around 0.5 or below. raw = max(0, s - 0.5) with a cutoff of 0.1, i.e. s above 0.6.
 * Seeded from the configured seed and the variable name, so a request is reproducible.
 */
@Component
public class IsolationForestDetector implements AnomalyDetector {

    static final int MIN_POINTS = 16;
    static final double CUTOFF = 0.1;
    private static final double EULER_GAMMA = 0.5772156649;

    @Override
    public DetectorType getType() {
        return DetectorType.ISOLATION;
    }

    @Override
    public DetectorScores score(DetectorInput input, AnomalyConfig config, DetectorState state) {
        int n = input.size();
        if (n < MIN_POINTS) {
            throw new InsufficientDataException(String.format(
                    "Isolation forest needs %d points, got %d", MIN_POINTS, n), n, MIN_POINTS);
        }
        double[][] rows = FeatureMatrix.build(input);
        int psi = Math.min(Math.max(2, config.getIsolationSubsample()), n);
        int depthLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        RandomGenerator random = new JDKRandomGenerator();
        random.setSeed(config.getSeed() * 31 + input.getVariable().hashCode());

        int trees = Math.max(1, config.getIsolationTrees());
        double[] pathSum = new double[n];
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        for (int tree = 0; tree < trees; tree++) {
            int[] sample = subsample(indices, psi, random);
            Node root = build(rows, sample, 0, sample.length, 0, depthLimit, random);
            for (int t = 0; t < n; t++) {
                pathSum[t] += pathLength(root, rows[t], 0);
            }
        }

        double norm = averagePathLength(psi);
        double[] raw = new double[n];
        for (int t = 0; t < n; t++) {
            double s = Math.pow(2.0, -(pathSum[t] / trees) / norm);
            raw[t] = Math.max(0.0, s - 0.5);
        }
        return new DetectorScores(getType(), raw, CUTOFF);
    }

    /**
     * c(n): average path length of an unsuccessful binary-search-tree lookup
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static int[] subsample(int[] indices, int size, RandomGenerator random) {
        int[] pool = indices.clone();
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.length - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }

    private static Node build(double[][] rows, int[] sample, int from, int to, int depth, int depthLimit,
                              RandomGenerator random) {
        int size = to - from;
        if (size <= 1 || depth >= depthLimit) {
            return Node.leaf(size);
        }
        int features = rows[0].length;
        int feature = random.nextInt(features);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double v = rows[sample[i]][feature];
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (max - min <= 0) {
            return Node.leaf(size);
        }
        double split = min + random.nextDouble() * (max - min);

        // partition in place: [from, mid) goes left
        int mid = from;
        for (int i = from; i < to; i++) {
            if (rows[sample[i]][feature] < split) {
                int tmp = sample[i];
                sample[i] = sample[mid];
                sample[mid] = tmp;
                mid++;
            }
        }
        Node left = build(rows, sample, from, mid, depth + 1, depthLimit, random);
        Node right = build(rows, sample, mid, to, depth + 1, depthLimit, random);
        return new Node(feature, split, left, right, 0);
    }

    private static double pathLength(Node node, double[] row, int depth) {
        Node current = node;
        int d = depth;
        while (current.left != null) {
            current = row[current.feature] < current.split ? current.left : current.right;
            d++;
        }
        return d + averagePathLength(current.size);
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }
    }
}
