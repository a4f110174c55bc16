package com.modelmonitor.scheduler;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.config.ThresholdsProvider;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.enums.MonitoringStatus;
import com.modelmonitor.domain.enums.SchedulerState;
import com.modelmonitor.domain.model.Issue;
import com.modelmonitor.domain.model.ModelThresholds;
import com.modelmonitor.domain.model.MonitoringRecord;
import com.modelmonitor.domain.model.MonitoringResult;
import com.modelmonitor.evaluation.ModelEvaluationService;
import com.modelmonitor.exception.PersistenceException;
import com.modelmonitor.observability.MonitoringMetrics;
import com.modelmonitor.retraining.DrainSummary;
import com.modelmonitor.retraining.RetrainingProcessor;
import com.modelmonitor.retraining.RetrainingService;
import com.modelmonitor.service.ModelStatusService;
import com.modelmonitor.store.MonitoringRecordStore;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Dedicated thread that runs the monitoring loop: evaluate every registered model, persist
 * the cycle's record, drain the retraining queue, then sleep for {@code interval}.
 *
 * <p>States: IDLE → EVALUATING → PERSISTING → DRAINING_QUEUE → IDLE. A failure that escapes a
 * cycle moves the loop to BACKOFF for {@code backoff} before the next attempt; it never ends
 * the loop. STOPPED is terminal.
 *
 * <p>{@link #stop()} wakes a sleeping loop immediately but lets a running phase finish. A
 * drain in progress stops between jobs and puts the rest back. If the loop thread has not
 * exited within {@code shutdown-timeout} it is interrupted.
 */
@Component
public class MonitoringScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MonitoringScheduler.class);

    private final ModelEvaluationService modelEvaluationService;
    private final ThresholdsProvider thresholdsProvider;
    private final MonitoringRecordStore monitoringRecordStore;
    private final RetrainingService retrainingService;
    private final RetrainingProcessor retrainingProcessor;
    private final ModelStatusService modelStatusService;
    private final MonitoringMetrics monitoringMetrics;
    private final MonitoringProperties monitoringProperties;
    private final AsyncTaskExecutor evaluationExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final ReentrantLock sleepLock = new ReentrantLock();
    private final Condition wakeUp = sleepLock.newCondition();
    private Thread loopThread;

    public MonitoringScheduler(
            ModelEvaluationService modelEvaluationService,
            ThresholdsProvider thresholdsProvider,
            MonitoringRecordStore monitoringRecordStore,
            RetrainingService retrainingService,
            RetrainingProcessor retrainingProcessor,
            ModelStatusService modelStatusService,
            MonitoringMetrics monitoringMetrics,
            MonitoringProperties monitoringProperties,
            @Qualifier("evaluationExecutor") AsyncTaskExecutor evaluationExecutor) {
        this.modelEvaluationService = modelEvaluationService;
        this.thresholdsProvider = thresholdsProvider;
        this.monitoringRecordStore = monitoringRecordStore;
        this.retrainingService = retrainingService;
        this.retrainingProcessor = retrainingProcessor;
        this.modelStatusService = modelStatusService;
        this.monitoringMetrics = monitoringMetrics;
        this.monitoringProperties = monitoringProperties;
        this.evaluationExecutor = evaluationExecutor;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            stopRequested.set(false);
            loopThread = new Thread(this::monitoringLoop, "monitoring-scheduler");
            loopThread.setDaemon(true);
            loopThread.start();
            log.info(
                    "MonitoringScheduler started: models={}, interval={}, initialDelay={}",
                    monitoringProperties.getModels(),
                    monitoringProperties.getInterval(),
                    monitoringProperties.getInitialDelay());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        stopRequested.set(true);
        log.info("MonitoringScheduler stopping, current state {}", state.get());
        wake();

        if (loopThread == null) {
            return;
        }
        try {
            loopThread.join(monitoringProperties.getShutdownTimeout().toMillis());
            if (loopThread.isAlive()) {
                log.warn(
                        "Monitoring loop still in {} after {}, interrupting",
                        state.get(),
                        monitoringProperties.getShutdownTimeout());
                loopThread.interrupt();
                loopThread.join(TimeUnit.SECONDS.toMillis(10));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Stop before the executors and connection factories are torn down
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    public SchedulerState getState() {
        return state.get();
    }

    private void monitoringLoop() {
        sleep(monitoringProperties.getInitialDelay());

        while (!stopRequested.get()) {
            try {
                runCycle();
                sleep(monitoringProperties.getInterval());
            } catch (RuntimeException e) {
                state.set(SchedulerState.BACKOFF);
                log.error(
                        "Monitoring cycle error, retrying in {}: {}",
                        monitoringProperties.getBackoff(),
                        e.getMessage(),
                        e);
                sleep(monitoringProperties.getBackoff());
            }
        }

        state.set(SchedulerState.STOPPED);
        log.info("MonitoringScheduler stopped");
    }

    /** Runs one full cycle on the calling thread. */
    public CycleReport runCycle() {
        long startedAt = System.nanoTime();
        log.info("Starting monitoring cycle");

        thresholdsProvider.reloadIfChanged();
        Map<ModelIdentity, ModelThresholds> thresholds = thresholdsProvider.snapshot();

        state.set(SchedulerState.EVALUATING);
        Map<ModelIdentity, MonitoringResult> results = evaluateAll(thresholds);

        int retrainingRequested = 0;
        for (MonitoringResult result : results.values()) {
            modelStatusService.updateFrom(result);
            recordMetrics(result);
            if (result.isNeedsRetraining()) {
                try {
                    retrainingService.requestRetraining(result);
                    retrainingRequested++;
                } catch (RuntimeException e) {
                    log.error(
                            "Failed to trigger retraining for {}: {}",
                            result.getModelIdentity().getKey(),
                            e.getMessage(),
                            e);
                }
            }
        }

        state.set(SchedulerState.PERSISTING);
        MonitoringRecord monitoringRecord = MonitoringRecord.builder()
                .timestamp(LocalDateTime.now())
                .results(results)
                .build();
        boolean persisted = false;
        try {
            monitoringRecord = monitoringRecordStore.append(monitoringRecord);
            persisted = true;
        } catch (PersistenceException e) {
            log.error("Failed to store monitoring results: {}", e.describe(), e);
        }

        state.set(SchedulerState.DRAINING_QUEUE);
        DrainSummary drainSummary = retrainingProcessor.drain(() -> !stopRequested.get());

        state.set(SchedulerState.IDLE);
        Duration duration = Duration.ofNanos(System.nanoTime() - startedAt);
        monitoringMetrics.recordCycle(duration);
        log.info(
                "Monitoring cycle finished in {} ms: models={}, retrainingRequested={}, persisted={}",
                duration.toMillis(),
                results.size(),
                retrainingRequested,
                persisted);

        return CycleReport.builder()
                .monitoringRecord(monitoringRecord)
                .persisted(persisted)
                .retrainingRequested(retrainingRequested)
                .drainSummary(drainSummary)
                .duration(duration)
                .build();
    }

    private Map<ModelIdentity, MonitoringResult> evaluateAll(Map<ModelIdentity, ModelThresholds> thresholds) {
        Map<ModelIdentity, Future<MonitoringResult>> futures = new LinkedHashMap<>();
        for (ModelIdentity modelIdentity : monitoringProperties.getModels()) {
            ModelThresholds modelThresholds = thresholds.get(modelIdentity);
            futures.put(
                    modelIdentity,
                    evaluationExecutor.submit(() -> modelEvaluationService.evaluateModel(modelIdentity, modelThresholds)));
        }

        long deadline = System.nanoTime() + monitoringProperties.getEvaluationTimeout().toNanos();
        Map<ModelIdentity, MonitoringResult> results = new EnumMap<>(ModelIdentity.class);
        for (Map.Entry<ModelIdentity, Future<MonitoringResult>> entry : futures.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), deadline));
        }
        return results;
    }

    private MonitoringResult await(ModelIdentity modelIdentity, Future<MonitoringResult> future, long deadline) {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Evaluation of {} timed out after {}", modelIdentity.getKey(),
                    monitoringProperties.getEvaluationTimeout());
            return MonitoringResult.error(
                    modelIdentity, "Evaluation timed out after " + monitoringProperties.getEvaluationTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Evaluation of {} failed: {}", modelIdentity.getKey(), cause.getMessage(), cause);
            return MonitoringResult.error(modelIdentity, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return MonitoringResult.error(modelIdentity, "Evaluation interrupted");
        }
    }

    private void recordMetrics(MonitoringResult result) {
        if (result.getStatus() == MonitoringStatus.ERROR) {
            monitoringMetrics.recordModelError(result.getModelIdentity());
        }
        for (Issue issue : result.getIssues()) {
            monitoringMetrics.recordIssue(result.getModelIdentity(), issue);
        }
    }

    private void sleep(Duration duration) {
        sleepLock.lock();
        try {
            long remaining = duration.toNanos();
            while (!stopRequested.get() && remaining > 0) {
                remaining = wakeUp.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
        } finally {
            sleepLock.unlock();
        }
    }

    private void wake() {
        sleepLock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            sleepLock.unlock();
        }
    }
}
