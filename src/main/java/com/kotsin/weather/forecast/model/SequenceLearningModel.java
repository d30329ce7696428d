package com.kotsin.weather.forecast.model;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.forecast.FittedModel;
import com.kotsin.weather.util.MathUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Random;

/**
 * SequenceLearningModel - LSTM one-step predictor applied recursively over the horizon.
 *
 * Each input step carries the standardized value plus sine/cosine of the calendar phase of every
 * seasonal period. Training is seeded, so a fit is reproducible for the same data and configuration.
 * Needs three full cycles of the longest seasonal period.
 *
 * Hyperparameters: look_back (14), hidden (8), epochs (20), learning_rate (0.01), batch_size (32),
 * clip_norm (1.0), max_samples (1000), seed (42)
 */
@Slf4j
public class SequenceLearningModel extends AbstractForecastModel {

    private static final int CYCLES_REQUIRED = 3;
    private static final int MIN_SAMPLES = 10;

    public SequenceLearningModel() {
        super(ModelVariant.SEQUENCE_LEARNING);
    }

    @Override
    public int minimumPoints(ModelConfig config) {
        return Math.max(CYCLES_REQUIRED * config.maxSeasonalPeriod(), lookBack(config) + MIN_SAMPLES);
    }

    private static int lookBack(ModelConfig config) {
        return Math.max(2, config.hyperInt("look_back", 14));
    }

    @Override
    protected FittedModel fitValues(double[] y, LocalDate[] dates, ModelConfig config) {
        int n = y.length;
        int lookBack = lookBack(config);
        int hidden = Math.max(2, config.hyperInt("hidden", 8));
        int epochs = Math.max(1, config.hyperInt("epochs", 20));
        int batchSize = Math.max(1, config.hyperInt("batch_size", 32));
        int maxSamples = Math.max(MIN_SAMPLES, config.hyperInt("max_samples", 1000));
        double learningRate = config.hyper("learning_rate", 0.01);
        double clipNorm = config.hyper("clip_norm", 1.0);
        Random random = new Random((long) config.hyper("seed", 42));

        double mean = MathUtils.mean(y);
        double std = MathUtils.std(y);
        double scale = MathUtils.isValidDenominator(std) ? std : 1.0;
        double[] z = new double[n];
        for (int t = 0; t < n; t++) {
            z[t] = (y[t] - mean) / scale;
        }

        int[] periods = config.getSeasonalPeriods().stream().filter(p -> p >= 2).mapToInt(Integer::intValue).toArray();
        Encoder encoder = new Encoder(lookBack, periods);
        LstmNetwork network = new LstmNetwork(encoder.inputSize(), hidden, random);

        int first = Math.max(lookBack, n - maxSamples);
        int[] order = new int[n - first];
        for (int i = 0; i < order.length; i++) {
            order[i] = first + i;
        }

        double loss = Double.NaN;
        for (int epoch = 0; epoch < epochs; epoch++) {
            checkInterrupted();
            shuffle(order, random);
            loss = 0;
            int inBatch = 0;
            for (int target : order) {
                loss += network.accumulate(encoder.window(z, dates, target), z[target]);
                if (++inBatch == batchSize) {
                    network.step(inBatch, learningRate, clipNorm);
                    inBatch = 0;
                    checkInterrupted();
                }
            }
            if (inBatch > 0) {
                network.step(inBatch, learningRate, clipNorm);
            }
            loss /= order.length;
            if (!Double.isFinite(loss)) {
                throw new ArithmeticException("Training diverged at epoch " + (epoch + 1));
            }
        }

        double[] fitted = new double[n];
        double ss = 0;
        int count = 0;
        for (int t = 0; t < n; t++) {
            if (t < lookBack) {
                fitted[t] = Double.NaN;
                continue;
            }
            fitted[t] = mean + scale * network.predict(encoder.window(z, dates, t));
            double r = y[t] - fitted[t];
            ss += r * r;
            count++;
        }
        double sigma2 = ss / Math.max(1, count - 1);

        log.debug("[FORECAST] sequence-learning trained: n={} lookBack={} hidden={} epochs={} loss={} sigma={}",
                n, lookBack, hidden, epochs, String.format("%.5f", loss), String.format("%.4f", Math.sqrt(sigma2)));
        return new Fitted(network, encoder, z, dates, mean, scale, sigma2, fitted, confidence(config));
    }

    private static void shuffle(int[] a, Random random) {
        for (int i = a.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = a[i];
            a[i] = a[j];
            a[j] = tmp;
        }
    }

    /**
     * Builds the input window ending the day before a target index
     */
    private static final class Encoder {
        private final int lookBack;
        private final int[] periods;

        private Encoder(int lookBack, int[] periods) {
            this.lookBack = lookBack;
            this.periods = periods;
        }

        private int inputSize() {
            return 1 + 2 * periods.length;
        }

        private double[][] window(double[] z, LocalDate[] dates, int target) {
            double[][] seq = new double[lookBack][inputSize()];
            for (int s = 0; s < lookBack; s++) {
                int t = target - lookBack + s;
                encode(seq[s], z[t], dates[t].toEpochDay());
            }
            return seq;
        }

        private void encode(double[] row, double value, long day) {
            row[0] = value;
            for (int i = 0; i < periods.length; i++) {
                double angle = 2.0 * Math.PI * (day % periods[i]) / periods[i];
                row[1 + 2 * i] = Math.sin(angle);
                row[2 + 2 * i] = Math.cos(angle);
            }
        }
    }

    private final class Fitted implements FittedModel {
        private final LstmNetwork network;
        private final Encoder encoder;
        private final double[] z;
        private final LocalDate[] dates;
        private final double mean;
        private final double scale;
        private final double sigma2;
        private final double[] fitted;
        private final double confidence;

        private Fitted(LstmNetwork network, Encoder encoder, double[] z, LocalDate[] dates, double mean,
                       double scale, double sigma2, double[] fitted, double confidence) {
            this.network = network;
            this.encoder = encoder;
            this.z = z;
            this.dates = dates;
            this.mean = mean;
            this.scale = scale;
            this.sigma2 = sigma2;
            this.fitted = fitted;
            this.confidence = confidence;
        }

        @Override
        public ModelVariant getVariant() {
            return ModelVariant.SEQUENCE_LEARNING;
        }

        @Override
        public synchronized ForecastResult predict(int horizon) {
            int n = z.length;
            double[] zExt = new double[n + horizon];
            LocalDate[] dExt = new LocalDate[n + horizon];
            System.arraycopy(z, 0, zExt, 0, n);
            System.arraycopy(dates, 0, dExt, 0, n);
            LocalDate last = dates[n - 1];
            double[] point = new double[horizon];
            double[] variance = new double[horizon];
            for (int h = 0; h < horizon; h++) {
                int t = n + h;
                dExt[t] = last.plusDays(h + 1L);
                zExt[t] = network.predict(encoder.window(zExt, dExt, t));
                point[h] = mean + scale * zExt[t];
                variance[h] = sigma2 * (h + 1);
            }
            return toResult(last, point, variance, confidence);
        }

        @Override
        public double[] fittedValues() {
            return fitted.clone();
        }
    }
}
