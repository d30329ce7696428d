package com.kotsin.weather.forecast.model;

import java.util.Random;

/**
 * Single-layer LSTM with a linear read-out of the last hidden state, trained with Adam.
 *
 * Parameters live in one flat array: input weights (4H x D), recurrent weights (4H x H), gate biases (4H),
 * read-out weights (H) and read-out bias (1). Gate order is input, forget, output, candidate.
 * Not thread-safe; one instance per fit.
 */
final class LstmNetwork {

    private static final double BETA1 = 0.9;
    private static final double BETA2 = 0.999;
    private static final double ADAM_EPSILON = 1e-8;

    private final int inputSize;
    private final int hiddenSize;
    private final int wxOffset;
    private final int whOffset;
    private final int bOffset;
    private final int wyOffset;
    private final int byOffset;

    private final double[] params;
    private final double[] grads;
    private final double[] adamM;
    private final double[] adamV;
    private int adamStep;

    LstmNetwork(int inputSize, int hiddenSize, Random random) {
        this.inputSize = inputSize;
        this.hiddenSize = hiddenSize;
        int gates = 4 * hiddenSize;
        this.wxOffset = 0;
        this.whOffset = wxOffset + gates * inputSize;
        this.bOffset = whOffset + gates * hiddenSize;
        this.wyOffset = bOffset + gates;
        this.byOffset = wyOffset + hiddenSize;
        int size = byOffset + 1;
        this.params = new double[size];
        this.grads = new double[size];
        this.adamM = new double[size];
        this.adamV = new double[size];

        double bound = 1.0 / Math.sqrt(hiddenSize);
        for (int i = 0; i < size; i++) {
            params[i] = (random.nextDouble() * 2.0 - 1.0) * bound;
        }
        for (int h = 0; h < hiddenSize; h++) {
            params[bOffset + hiddenSize + h] = 1.0; // forget gate starts open
        }
    }

    /**
     * Activations of one forward pass, kept for back-propagation
     */
    private final class Trace {
        final double[][] x;
        final double[][] i;
        final double[][] f;
        final double[][] o;
        final double[][] g;
        final double[][] c;
        final double[][] h;
        double output;

        Trace(double[][] sequence) {
            int steps = sequence.length;
            x = sequence;
            i = new double[steps][hiddenSize];
            f = new double[steps][hiddenSize];
            o = new double[steps][hiddenSize];
            g = new double[steps][hiddenSize];
            c = new double[steps + 1][hiddenSize];
            h = new double[steps + 1][hiddenSize];
        }
    }

    double predict(double[][] sequence) {
        return forward(sequence).output;
    }

    private Trace forward(double[][] sequence) {
        Trace tr = new Trace(sequence);
        int gates = 4 * hiddenSize;
        double[] z = new double[gates];
        for (int t = 0; t < sequence.length; t++) {
            double[] xt = sequence[t];
            double[] hPrev = tr.h[t];
            for (int r = 0; r < gates; r++) {
                double v = params[bOffset + r];
                int wx = wxOffset + r * inputSize;
                for (int k = 0; k < inputSize; k++) {
                    v += params[wx + k] * xt[k];
                }
                int wh = whOffset + r * hiddenSize;
                for (int k = 0; k < hiddenSize; k++) {
                    v += params[wh + k] * hPrev[k];
                }
                z[r] = v;
            }
            for (int k = 0; k < hiddenSize; k++) {
                double ig = sigmoid(z[k]);
                double fg = sigmoid(z[hiddenSize + k]);
                double og = sigmoid(z[2 * hiddenSize + k]);
                double gg = Math.tanh(z[3 * hiddenSize + k]);
                double c = fg * tr.c[t][k] + ig * gg;
                tr.i[t][k] = ig;
                tr.f[t][k] = fg;
                tr.o[t][k] = og;
                tr.g[t][k] = gg;
                tr.c[t + 1][k] = c;
                tr.h[t + 1][k] = og * Math.tanh(c);
            }
        }
        double out = params[byOffset];
        double[] last = tr.h[sequence.length];
        for (int k = 0; k < hiddenSize; k++) {
            out += params[wyOffset + k] * last[k];
        }
        tr.output = out;
        return tr;
    }

    /**
     * Accumulate squared-error gradients of one sample; returns the sample loss
     */
    double accumulate(double[][] sequence, double target) {
        Trace tr = forward(sequence);
        int steps = sequence.length;
        double err = tr.output - target;

        double[] last = tr.h[steps];
        grads[byOffset] += err;
        double[] dh = new double[hiddenSize];
        for (int k = 0; k < hiddenSize; k++) {
            grads[wyOffset + k] += err * last[k];
            dh[k] = err * params[wyOffset + k];
        }
        double[] dc = new double[hiddenSize];
        double[] dz = new double[4 * hiddenSize];

        for (int t = steps - 1; t >= 0; t--) {
            for (int k = 0; k < hiddenSize; k++) {
                double tc = Math.tanh(tr.c[t + 1][k]);
                double dO = dh[k] * tc;
                dc[k] += dh[k] * tr.o[t][k] * (1.0 - tc * tc);
                double dI = dc[k] * tr.g[t][k];
                double dG = dc[k] * tr.i[t][k];
                double dF = dc[k] * tr.c[t][k];
                dz[k] = dI * tr.i[t][k] * (1.0 - tr.i[t][k]);
                dz[hiddenSize + k] = dF * tr.f[t][k] * (1.0 - tr.f[t][k]);
                dz[2 * hiddenSize + k] = dO * tr.o[t][k] * (1.0 - tr.o[t][k]);
                dz[3 * hiddenSize + k] = dG * (1.0 - tr.g[t][k] * tr.g[t][k]);
                dc[k] = dc[k] * tr.f[t][k];
            }
            double[] xt = tr.x[t];
            double[] hPrev = tr.h[t];
            double[] dhPrev = new double[hiddenSize];
            for (int r = 0; r < 4 * hiddenSize; r++) {
                double d = dz[r];
                if (d == 0.0) {
                    continue;
                }
                grads[bOffset + r] += d;
                int wx = wxOffset + r * inputSize;
                for (int k = 0; k < inputSize; k++) {
                    grads[wx + k] += d * xt[k];
                }
                int wh = whOffset + r * hiddenSize;
                for (int k = 0; k < hiddenSize; k++) {
                    grads[wh + k] += d * hPrev[k];
                    dhPrev[k] += params[wh + k] * d;
                }
            }
            dh = dhPrev;
        }
        return 0.5 * err * err;
    }

    /**
     * Adam update with the averaged, norm-clipped accumulated gradient; clears the accumulator
     */
    void step(int batchSize, double learningRate, double clipNorm) {
        double norm = 0;
        for (int p = 0; p < grads.length; p++) {
            grads[p] /= batchSize;
            norm += grads[p] * grads[p];
        }
        norm = Math.sqrt(norm);
        double scale = norm > clipNorm ? clipNorm / norm : 1.0;

        adamStep++;
        double correction1 = 1.0 - Math.pow(BETA1, adamStep);
        double correction2 = 1.0 - Math.pow(BETA2, adamStep);
        for (int p = 0; p < params.length; p++) {
            double g = grads[p] * scale;
            adamM[p] = BETA1 * adamM[p] + (1.0 - BETA1) * g;
            adamV[p] = BETA2 * adamV[p] + (1.0 - BETA2) * g * g;
            double mHat = adamM[p] / correction1;
            double vHat = adamV[p] / correction2;
            params[p] -= learningRate * mHat / (Math.sqrt(vHat) + ADAM_EPSILON);
            grads[p] = 0.0;
        }
    }

    private static double sigmoid(double v) {
        return 1.0 / (1.0 + Math.exp(-v));
    }
}
