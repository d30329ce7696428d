package com.kotsin.weather.anomaly.impl;

import com.kotsin.weather.anomaly.AnomalyConfig;
import com.kotsin.weather.anomaly.AnomalyDetector;
import com.kotsin.weather.anomaly.DetectorInput;
import com.kotsin.weather.anomaly.DetectorScores;
import com.kotsin.weather.anomaly.DetectorState;
import com.kotsin.weather.domain.model.DetectorType;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Distance to the nearest dense k-means centroid.
 *
 * Clusters holding fewer than max(3, minClusterFraction * n) points are treated as noise and are not
 * candidates for "nearest". Distances are scored against their median in robust standard deviations.
 */
@Component
@Slf4j
public class ClusteringDistanceDetector implements AnomalyDetector {

    private static final int MAX_ITERATIONS = 100;
    private static final int MIN_CLUSTER_SIZE = 3;

    private final EuclideanDistance distance = new EuclideanDistance();

    @Override
    public DetectorType getType() {
        return DetectorType.CLUSTERING_DISTANCE;
    }

    @Override
    public DetectorScores score(DetectorInput input, AnomalyConfig config, DetectorState state) {
        int n = input.size();
        int k = Math.max(1, config.getClusterCount());
        if (n < 2 * k) {
            throw new InsufficientDataException(String.format(
                    "Clustering with %d clusters needs %d points, got %d", k, 2 * k, n), n, 2 * k);
        }
        double[][] rows = FeatureMatrix.build(input);
        List<DoublePoint> points = new ArrayList<>(n);
        for (double[] row : rows) {
            points.add(new DoublePoint(row));
        }

        JDKRandomGenerator random = new JDKRandomGenerator();
        random.setSeed(config.getSeed() * 31 + input.getVariable().hashCode());
        KMeansPlusPlusClusterer<DoublePoint> clusterer =
                new KMeansPlusPlusClusterer<>(k, MAX_ITERATIONS, distance, random);
        List<CentroidCluster<DoublePoint>> clusters = clusterer.cluster(points);

        int minSize = (int) Math.max(MIN_CLUSTER_SIZE, Math.ceil(config.getMinClusterFraction() * n));
        List<double[]> centroids = new ArrayList<>();
        for (CentroidCluster<DoublePoint> cluster : clusters) {
            if (cluster.getPoints().size() >= minSize) {
                centroids.add(cluster.getCenter().getPoint());
            }
        }
        if (centroids.isEmpty()) {
            log.debug("[ANOMALY] {}: no dense cluster, using all centroids", input.getVariable());
            clusters.forEach(c -> centroids.add(c.getCenter().getPoint()));
        }

        double[] nearest = new double[n];
        for (int t = 0; t < n; t++) {
            double best = Double.POSITIVE_INFINITY;
            for (double[] centroid : centroids) {
                best = Math.min(best, distance.compute(rows[t], centroid));
            }
            nearest[t] = best;
        }

        double median = MathUtils.median(nearest);
        double scale = MathUtils.MAD_TO_SIGMA * MathUtils.mad(nearest);
        double[] raw = new double[n];
        for (int t = 0; t < n; t++) {
            double excess = Math.max(0.0, nearest[t] - median);
            raw[t] = TrailingWindowSupport.ratio(excess, scale);
        }
        return new DetectorScores(getType(), raw, config.getClusterThreshold());
    }
}
