package com.modelmonitor.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for the monitoring loop. Evaluations of different models run in parallel
 * on {@code evaluationExecutor}; training runs one at a time on {@code trainingExecutor}
 * so the loop can time-box it.
 */
@Configuration
public class AsyncConfig {

    @Value("${model-monitor.async.evaluation-pool-size:3}")
    private int evaluationPoolSize;

    @Value("${model-monitor.async.training-pool-size:1}")
    private int trainingPoolSize;

    @Bean("evaluationExecutor")
    public ThreadPoolTaskExecutor evaluationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(evaluationPoolSize);
        executor.setMaxPoolSize(evaluationPoolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("evaluate-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("trainingExecutor")
    public ThreadPoolTaskExecutor trainingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(trainingPoolSize);
        executor.setMaxPoolSize(trainingPoolSize);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("train-");
        // A timed-out training call is cancelled with interrupt; do not wait for it on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
