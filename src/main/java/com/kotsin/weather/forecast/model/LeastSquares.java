package com.kotsin.weather.forecast.model;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;

/**
 * Penalized least squares on the normal equations: (X'X + diag(penalty)) b = X'y.
 *
 * Throws {@link ArithmeticException} when the system is singular or the solution is not finite;
 * callers translate that into a model fit failure.
 */
final class LeastSquares {

    private LeastSquares() {}

    static final class Solution {
        final double[] coefficients;
        final double[] fitted;
        final double[] residuals;
        final double residualVariance;

        private Solution(double[] coefficients, double[] fitted, double[] residuals, double residualVariance) {
            this.coefficients = coefficients;
            this.fitted = fitted;
            this.residuals = residuals;
            this.residualVariance = residualVariance;
        }
    }

    static Solution solve(double[][] x, double[] y, double[] penalty) {
        int n = x.length;
        int k = x[0].length;
        if (n <= k) {
            throw new ArithmeticException("Underdetermined system: " + n + " rows for " + k + " columns");
        }
        RealMatrix design = new Array2DRowRealMatrix(x, false);
        RealMatrix normal = design.transpose().multiply(design);
        for (int j = 0; j < k; j++) {
            normal.addToEntry(j, j, penalty[j]);
        }
        RealVector rhs = design.transpose().operate(new ArrayRealVector(y, false));

        DecompositionSolver solver = new LUDecomposition(normal).getSolver();
        if (!solver.isNonSingular()) {
            throw new ArithmeticException("Singular design matrix");
        }
        double[] beta = solver.solve(rhs).toArray();
        for (double b : beta) {
            if (!Double.isFinite(b)) {
                throw new ArithmeticException("Non-finite coefficient");
            }
        }

        double[] fitted = design.operate(beta);
        double[] residuals = new double[n];
        double ss = 0;
        for (int i = 0; i < n; i++) {
            residuals[i] = y[i] - fitted[i];
            ss += residuals[i] * residuals[i];
        }
        return new Solution(beta, fitted, residuals, ss / Math.max(1, n - k));
    }

    /**
     * Uniform penalty for every column
     */
    static double[] uniform(int k, double value) {
        double[] p = new double[k];
        Arrays.fill(p, value);
        return p;
    }
}
