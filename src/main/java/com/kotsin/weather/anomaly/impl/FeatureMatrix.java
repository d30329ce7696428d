package com.kotsin.weather.anomaly.impl;

import com.kotsin.weather.anomaly.DetectorInput;
import com.kotsin.weather.util.MathUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Standardized multivariate features of each point: the value, its first difference and every covariate.
 * Covariates are taken in name order so the layout is stable across runs.
 */
final class FeatureMatrix {

    private FeatureMatrix() {}

    static double[][] build(DetectorInput input) {
        int n = input.size();
        List<double[]> columns = new ArrayList<>();
        double[] values = input.getValues();
        columns.add(MathUtils.standardize(values));

        double[] diff = new double[n];
        for (int t = 1; t < n; t++) {
            diff[t] = values[t] - values[t - 1];
        }
        columns.add(MathUtils.standardize(diff));

        if (input.getCovariates() != null) {
            for (Map.Entry<String, double[]> e : new TreeMap<>(input.getCovariates()).entrySet()) {
                if (e.getValue() != null && e.getValue().length == n) {
                    columns.add(MathUtils.standardize(e.getValue()));
                }
            }
        }

        double[][] rows = new double[n][columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            double[] column = columns.get(j);
            for (int t = 0; t < n; t++) {
                rows[t][j] = Double.isFinite(column[t]) ? column[t] : 0.0;
            }
        }
        return rows;
    }
}
