package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.domain.model.ValidationMetric;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.exception.ModelFitException;
import com.kotsin.weather.exception.ResourceExhaustedException;
import com.kotsin.weather.exception.WeatherInsightException;
import com.kotsin.weather.metrics.PipelineMetrics;
import com.kotsin.weather.monitoring.ResourceGovernor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ForecastOrchestrator - runs every configured adapter as an independent task and waits for all of them.
 *
 * One task per adapter fits, cross-validates and predicts. The barrier is "wait for all, collect partial
 * successes": a failing, rejected or timed-out adapter becomes a {@link ModelOutcome} with a diagnostic and
 * never aborts the others.
 *
 * The per-model timeout runs from the moment a pool thread starts the adapter, so time spent queued behind
 * other adapters is not charged to it. On expiry the task is cancelled with interruption. A submission the
 * model pool cannot accept is recorded as {@link ModelStatus#REJECTED}.
 *
 * All adapters of a run are validated on the same fold origins, and when their metrics still end up mixing
 * in-sample and rolling-origin errors every survivor is switched to in-sample errors, so the ensemble weights
 * always compare like with like.
 */
@Component
@Slf4j
public class ForecastOrchestrator {

    private static final long POLL_MS = 50;

    private final ForecastModelFactory modelFactory;
    private final CrossValidator crossValidator;
    private final ResourceGovernor governor;
    private final PipelineMetrics metrics;
    private final AsyncTaskExecutor modelExecutor;

    public ForecastOrchestrator(ForecastModelFactory modelFactory,
                                CrossValidator crossValidator,
                                ResourceGovernor governor,
                                PipelineMetrics metrics,
                                @Qualifier("modelExecutor") AsyncTaskExecutor modelExecutor) {
        this.modelFactory = modelFactory;
        this.crossValidator = crossValidator;
        this.governor = governor;
        this.metrics = metrics;
        this.modelExecutor = modelExecutor;
    }

    /**
     * One adapter of a run. {@code startedAt} stays 0 until a pool thread picks the task up.
     */
    private static final class AdapterTask {
        final ModelConfig config;
        final ForecastModel model;
        final AtomicLong startedAt = new AtomicLong();
        Future<ModelOutcome> future;
        ModelOutcome outcome;

        AdapterTask(ModelConfig config, ForecastModel model) {
            this.config = config;
            this.model = model;
        }

        ModelVariant variant() {
            return config.getVariant();
        }
    }

    /**
     * Run all adapters on one variable.
     *
     * @param series          complete modelling series
     * @param variable        variable to forecast
     * @param configs         one configuration per adapter
     * @param cvFolds         rolling-origin folds per adapter
     * @param timeout         per-model timeout
     * @param maxSequenceLength longest series accepted by the sequence-learning adapter
     * @return one outcome per configuration, in configuration order
     */
    public List<ModelOutcome> run(TimeSeries series, String variable, List<ModelConfig> configs, int cvFolds,
                                  Duration timeout, int maxSequenceLength) {
        long start = System.currentTimeMillis();
        List<AdapterTask> tasks = new ArrayList<>();

        for (ModelConfig config : configs) {
            if (config.getVariant() == ModelVariant.SEQUENCE_LEARNING) {
                try {
                    governor.checkSequenceModel(series.size(), maxSequenceLength);
                } catch (ResourceExhaustedException e) {
                    log.warn("[FORECAST] {} rejected: {}", config.getVariant().getId(), e.getMessage());
                    AdapterTask rejected = new AdapterTask(config, null);
                    rejected.outcome = ModelOutcome.failed(config.getVariant(), ModelStatus.REJECTED,
                            e.getErrorCode(), e.getMessage(), 0);
                    tasks.add(rejected);
                    continue;
                }
            }
            tasks.add(new AdapterTask(config, modelFactory.create(config.getVariant())));
        }

        int minimumOrigin = commonMinimumOrigin(tasks, series.size());
        Semaphore finished = new Semaphore(0);
        for (AdapterTask task : tasks) {
            if (task.outcome == null) {
                submit(task, series, variable, cvFolds, minimumOrigin, finished);
            }
        }

        supervise(tasks, timeout, finished);
        alignValidation(tasks);

        List<ModelOutcome> outcomes = new ArrayList<>();
        for (AdapterTask task : tasks) {
            metrics.incModelOutcome(task.variant(), task.outcome.getStatus());
            outcomes.add(task.outcome);
        }

        long succeeded = outcomes.stream().filter(ModelOutcome::isSucceeded).count();
        log.info("[FORECAST] {} {}: {}/{} adapters succeeded in {}ms", series.getSeriesId(), variable,
                succeeded, outcomes.size(), System.currentTimeMillis() - start);
        return outcomes;
    }

    /**
     * Largest data requirement among the adapters that can fit the series at all
     */
    private static int commonMinimumOrigin(List<AdapterTask> tasks, int seriesLength) {
        int origin = 0;
        for (AdapterTask task : tasks) {
            if (task.model == null) {
                continue;
            }
            int minimum = task.model.minimumPoints(task.config);
            if (minimum <= seriesLength) {
                origin = Math.max(origin, minimum);
            }
        }
        return origin;
    }

    private void submit(AdapterTask task, TimeSeries series, String variable, int cvFolds, int minimumOrigin,
                        Semaphore finished) {
        try {
            task.future = modelExecutor.submit(() -> {
                task.startedAt.set(System.currentTimeMillis());
                try {
                    return runAdapter(task, series, variable, cvFolds, minimumOrigin);
                } finally {
                    finished.release();
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("[FORECAST] {} rejected by the model executor: {}", task.variant().getId(), e.getMessage());
            task.outcome = ModelOutcome.failed(task.variant(), ModelStatus.REJECTED, null,
                    "Model executor is saturated", 0);
        }
    }

    /**
     * Wait for every submitted adapter, cancelling each one whose own running time exceeds the timeout.
     * Tasks still queued after every adapter could have used its full timeout one after another are
     * treated as timed out.
     */
    private void supervise(List<AdapterTask> tasks, Duration timeout, Semaphore finished) {
        long timeoutMs = timeout.toMillis();
        long maxQueueWait = timeoutMs * (tasks.size() + 1L);
        long queueDeadline = System.currentTimeMillis() + maxQueueWait;

        while (true) {
            long now = System.currentTimeMillis();
            long wait = POLL_MS;
            boolean pending = false;
            for (AdapterTask task : tasks) {
                if (task.outcome != null) {
                    continue;
                }
                if (task.future.isDone()) {
                    task.outcome = collect(task);
                    continue;
                }
                long startedAt = task.startedAt.get();
                if (startedAt == 0) {
                    if (now >= queueDeadline) {
                        task.future.cancel(true);
                        log.warn("[FORECAST] {} never started within {}ms", task.variant().getId(), maxQueueWait);
                        task.outcome = ModelOutcome.failed(task.variant(), ModelStatus.TIMED_OUT, null,
                                "Adapter never started on the model executor", 0);
                        continue;
                    }
                } else {
                    long remaining = startedAt + timeoutMs - now;
                    if (remaining <= 0) {
                        task.future.cancel(true);
                        log.warn("[FORECAST] {} timed out after {}ms", task.variant().getId(), timeoutMs);
                        task.outcome = ModelOutcome.failed(task.variant(), ModelStatus.TIMED_OUT, null,
                                String.format("Exceeded per-model timeout of %dms", timeoutMs), now - startedAt);
                        continue;
                    }
                    wait = Math.min(wait, remaining);
                }
                pending = true;
            }
            if (!pending) {
                return;
            }
            try {
                finished.tryAcquire(Math.max(1, wait), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (AdapterTask task : tasks) {
                    if (task.outcome == null) {
                        task.future.cancel(true);
                        task.outcome = ModelOutcome.failed(task.variant(), ModelStatus.FIT_FAILED, null,
                                "Interrupted while waiting", 0);
                    }
                }
                return;
            }
        }
    }

    private ModelOutcome collect(AdapterTask task) {
        long startedAt = task.startedAt.get();
        long elapsed = startedAt == 0 ? 0 : System.currentTimeMillis() - startedAt;
        try {
            return task.future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ModelOutcome.failed(task.variant(), ModelStatus.FIT_FAILED, null, "Interrupted while waiting",
                    elapsed);
        } catch (ExecutionException e) {
            return failure(task.variant(), e.getCause(), elapsed);
        }
    }

    /**
     * When survivors mix in-sample and rolling-origin metrics, fall back to in-sample errors for all of them.
     */
    private void alignValidation(List<AdapterTask> tasks) {
        List<AdapterTask> survivors = new ArrayList<>();
        for (AdapterTask task : tasks) {
            if (task.outcome.isSucceeded()) {
                survivors.add(task);
            }
        }
        boolean anyInSample = survivors.stream().anyMatch(t -> t.outcome.getMetric().isInSample());
        boolean anyRolling = survivors.stream().anyMatch(t -> !t.outcome.getMetric().isInSample());
        if (!anyInSample || !anyRolling) {
            return;
        }
        if (survivors.stream().anyMatch(t -> t.outcome.getInSampleMetric() == null)) {
            log.warn("[CV] Mixed in-sample and rolling-origin metrics, but not every survivor has in-sample "
                    + "errors; keeping the mixed metrics");
            return;
        }
        log.warn("[CV] Mixed in-sample and rolling-origin metrics across {} survivors, using in-sample errors "
                + "for all", survivors.size());
        for (AdapterTask task : survivors) {
            ValidationMetric inSample = task.outcome.getInSampleMetric().toBuilder()
                    .failedFolds(task.outcome.getMetric().getFailedFolds())
                    .build();
            task.outcome = task.outcome.withMetric(inSample);
        }
    }

    private ModelOutcome runAdapter(AdapterTask task, TimeSeries series, String variable, int cvFolds,
                                    int minimumOrigin) {
        long start = System.currentTimeMillis();
        ModelConfig config = task.config;
        FittedModel fitted = task.model.fit(series, variable, config);
        ForecastResult forecast = fitted.predict(config.getHorizon());
        ValidationMetric metric = crossValidator.validate(task.model, series, variable, config, cvFolds,
                minimumOrigin, fitted, forecast);
        ValidationMetric inSample = metric.isInSample()
                ? metric
                : crossValidator.inSampleMetric(task.model, series.values(variable), fitted, forecast);
        long elapsed = System.currentTimeMillis() - start;
        log.debug("[FORECAST] {} done in {}ms (mae={})", config.getVariant().getId(), elapsed, metric.getMae());
        return ModelOutcome.succeeded(config.getVariant(), forecast, metric, inSample, elapsed);
    }

    private static ModelOutcome failure(ModelVariant variant, Throwable cause, long elapsed) {
        ModelStatus status;
        if (cause instanceof InsufficientDataException) {
            status = ModelStatus.INSUFFICIENT_DATA;
        } else if (cause instanceof ResourceExhaustedException) {
            status = ModelStatus.REJECTED;
        } else {
            status = ModelStatus.FIT_FAILED;
        }
        String code = cause instanceof WeatherInsightException wie ? wie.getErrorCode() : null;
        if (cause instanceof ModelFitException || cause instanceof InsufficientDataException) {
            log.warn("[FORECAST] {} failed: {}", variant.getId(), cause.getMessage());
        } else {
            log.warn("[FORECAST] {} failed unexpectedly: {}", variant.getId(), cause.toString(), cause);
        }
        return ModelOutcome.failed(variant, status, code, cause.getMessage(), elapsed);
    }
}
