package com.kotsin.weather.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * AsyncConfig - thread pools of the forecasting and detection pipeline.
 *
 * Provides:
 * - modelExecutor: one task per forecasting model (fit, validate, predict)
 * - validationExecutor: one task per cross-validation fold
 * - detectorExecutor: one task per (variable, detector)
 *
 * Folds run on their own pool so a model task waiting on its folds can never starve them.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    private final WeatherInsightProperties.ExecutorConfig config;

    public AsyncConfig(WeatherInsightProperties properties) {
        this.config = properties.getExecutor();
    }

    @Bean(name = "modelExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor modelExecutor() {
        return build("MODEL-EXECUTOR", "forecast-model-", config.getModelPoolSize(), config.getQueueCapacity(), false);
    }

    @Bean(name = "validationExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor validationExecutor() {
        return build("CV-EXECUTOR", "cv-fold-", config.getValidationPoolSize(), config.getQueueCapacity());
    }

    @Bean(name = "detectorExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor detectorExecutor() {
        return build("DETECTOR-EXECUTOR", "anomaly-detector-", config.getDetectorPoolSize(), config.getQueueCapacity());
    }

    /**
     * Fixed-size pool. When the queue is full the caller runs the task itself (backpressure), so a
     * submitted fold or detector is never dropped and every future completes.
     */
    public static ThreadPoolTaskExecutor build(String tag, String threadPrefix, int poolSize, int queueCapacity) {
        return build(tag, threadPrefix, poolSize, queueCapacity, true);
    }

    /**
     * Fixed-size pool. With {@code callerRuns} false a full queue rejects the submission with
     * {@link org.springframework.core.task.TaskRejectedException}; model tasks must run on a pool thread
     * where their timeout can be enforced.
     */
    public static ThreadPoolTaskExecutor build(String tag, String threadPrefix, int poolSize, int queueCapacity,
                                               boolean callerRuns) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadPrefix);

        if (callerRuns) {
            executor.setRejectedExecutionHandler(new RejectedExecutionHandler() {
                @Override
                public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                    log.warn("[{}] Queue full, executing in caller thread. activeCount={}, queueSize={}",
                            tag, e.getActiveCount(), e.getQueue().size());
                    if (!e.isShutdown()) {
                        r.run();
                    }
                }
            });
        } else {
            executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        }

        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);

        // Timed-out model tasks are cancelled with interruption; do not wait for them on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.initialize();

        log.info("[{}] Initialized: poolSize={}, queueCapacity={}, threadPrefix={}, callerRuns={}",
                tag, poolSize, queueCapacity, threadPrefix, callerRuns);
        return executor;
    }
}
