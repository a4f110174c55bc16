package com.modelmonitor.retraining;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.domain.enums.AlertSeverity;
import com.modelmonitor.domain.enums.AlertType;
import com.modelmonitor.domain.enums.ModelHealth;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.RetrainingJob;
import com.modelmonitor.domain.model.TrainingResult;
import com.modelmonitor.drift.BaselineService;
import com.modelmonitor.exception.MaxAttemptsExceededException;
import com.modelmonitor.exception.NotificationException;
import com.modelmonitor.exception.TrainingFailureException;
import com.modelmonitor.notification.Alert;
import com.modelmonitor.notification.AlertNotifier;
import com.modelmonitor.observability.MonitoringMetrics;
import com.modelmonitor.service.ModelStatusService;
import com.modelmonitor.trainer.Trainer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Drains the retraining queue and runs each job through the {@link Trainer}.
 *
 * <p>Training runs on {@code trainingExecutor} and is bounded by
 * {@code model-monitor.training-timeout}; a timed-out run is cancelled and counts as a failed
 * attempt. A failed job is requeued with its attempt count incremented until it has failed
 * {@code model-monitor.max-attempts} times, after which it is dropped with a CRITICAL alert.
 *
 * <p>The continue flag is checked between jobs only. When it turns false, or the draining
 * thread is interrupted, the unprocessed jobs are restored unchanged.
 *
 * <p>Every dequeued job ends up succeeded, abandoned, back in the queue, or in the dead-letter
 * store. A failed push never escapes the drain.
 */
@Component
public class RetrainingProcessor {

    private static final Logger log = LoggerFactory.getLogger(RetrainingProcessor.class);

    private final RetrainingQueue retrainingQueue;
    private final Trainer trainer;
    private final AsyncTaskExecutor trainingExecutor;
    private final AlertNotifier alertNotifier;
    private final ModelStatusService modelStatusService;
    private final BaselineService baselineService;
    private final MonitoringMetrics monitoringMetrics;
    private final MonitoringProperties monitoringProperties;

    public RetrainingProcessor(
            RetrainingQueue retrainingQueue,
            Trainer trainer,
            @Qualifier("trainingExecutor") AsyncTaskExecutor trainingExecutor,
            AlertNotifier alertNotifier,
            ModelStatusService modelStatusService,
            BaselineService baselineService,
            MonitoringMetrics monitoringMetrics,
            MonitoringProperties monitoringProperties) {
        this.retrainingQueue = retrainingQueue;
        this.trainer = trainer;
        this.trainingExecutor = trainingExecutor;
        this.alertNotifier = alertNotifier;
        this.modelStatusService = modelStatusService;
        this.baselineService = baselineService;
        this.monitoringMetrics = monitoringMetrics;
        this.monitoringProperties = monitoringProperties;
    }

    public DrainSummary drain(BooleanSupplier keepRunning) {
        List<RetrainingJob> jobs = retrainingQueue.dequeueAll();
        if (jobs.isEmpty()) {
            return DrainSummary.empty();
        }

        Tally tally = new Tally();
        for (int i = 0; i < jobs.size(); i++) {
            RetrainingJob job = jobs.get(i);

            if (!keepRunning.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                restoreFrom(jobs, i, tally);
                break;
            }

            try {
                process(job);
                tally.succeeded++;
            } catch (TrainingFailureException e) {
                switch (handleFailure(job, e)) {
                    case REQUEUED -> tally.requeued++;
                    case ABANDONED -> tally.abandoned++;
                    case DEAD_LETTERED -> tally.deadLettered++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retraining of {} interrupted, restoring unprocessed jobs", job.getModelIdentity().getKey());
                restoreFrom(jobs, i, tally);
                break;
            } catch (RuntimeException e) {
                log.error(
                        "Retraining job {} for {} failed unexpectedly, putting it back: {}",
                        job.getId(),
                        job.getModelIdentity().getKey(),
                        e.getMessage(),
                        e);
                putBack(job, tally);
            }
        }

        refreshQueueDepth();
        DrainSummary result = DrainSummary.builder()
                .dequeued(jobs.size())
                .succeeded(tally.succeeded)
                .requeued(tally.requeued)
                .abandoned(tally.abandoned)
                .restored(tally.restored)
                .deadLettered(tally.deadLettered)
                .build();
        log.info(
                "Retraining queue drained: dequeued={}, succeeded={}, requeued={}, abandoned={}, restored={},"
                        + " deadLettered={}",
                result.getDequeued(),
                result.getSucceeded(),
                result.getRequeued(),
                result.getAbandoned(),
                result.getRestored(),
                result.getDeadLettered());
        return result;
    }

    private void process(RetrainingJob job) throws InterruptedException {
        ModelIdentity modelIdentity = job.getModelIdentity();
        log.info(
                "Processing retraining job: id={}, model={}, attempt={}",
                job.getId(),
                modelIdentity.getKey(),
                job.getAttemptCount() + 1);
        modelStatusService.update(modelIdentity, ModelHealth.RETRAINING);

        TrainingResult result = runTimeBoxed(modelIdentity);
        if (!result.isSuccess()) {
            throw new TrainingFailureException(
                    modelIdentity, result.getError() != null ? result.getError() : "Unknown error");
        }

        log.info("Retraining completed for {}: metrics={}", modelIdentity.getKey(), result.getMetrics());
        modelStatusService.update(modelIdentity, ModelHealth.RETRAINED);
        monitoringMetrics.recordJobOutcome("succeeded");
        sendAlert(Alert.builder()
                .type(AlertType.RETRAINING_SUCCEEDED)
                .severity(AlertSeverity.INFO)
                .modelIdentity(modelIdentity)
                .title("Model retrained")
                .message("Retraining completed with metrics: " + result.getMetrics())
                .build());

        if (monitoringProperties.getDrift().isResetBaselineAfterRetrain()) {
            try {
                baselineService.resetBaseline(modelIdentity);
            } catch (RuntimeException e) {
                log.warn("Baseline reset after retraining {} failed: {}", modelIdentity.getKey(), e.getMessage());
            }
        }
    }

    private TrainingResult runTimeBoxed(ModelIdentity modelIdentity) throws InterruptedException {
        Duration timeout = monitoringProperties.getTrainingTimeout();
        Future<TrainingResult> future = trainingExecutor.submit(() -> trainer.train(modelIdentity));
        try {
            TrainingResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new TrainingFailureException(modelIdentity, "Trainer returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TrainingFailureException(modelIdentity, "Training timed out after " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TrainingFailureException(modelIdentity, "Training failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private FailureOutcome handleFailure(RetrainingJob job, TrainingFailureException failure) {
        ModelIdentity modelIdentity = job.getModelIdentity();
        int maxAttempts = monitoringProperties.getMaxAttempts();
        int attemptsMade = job.getAttemptCount() + 1;
        modelStatusService.update(modelIdentity, ModelHealth.RETRAINING_FAILED);

        if (attemptsMade >= maxAttempts) {
            MaxAttemptsExceededException abandoned = new MaxAttemptsExceededException(job, maxAttempts, failure);
            log.error("{}: last error: {}", abandoned.describe(), failure.describe());
            monitoringMetrics.recordJobOutcome("abandoned");
            sendAlert(Alert.builder()
                    .type(AlertType.RETRAINING_ABANDONED)
                    .severity(AlertSeverity.CRITICAL)
                    .modelIdentity(modelIdentity)
                    .title("Retraining abandoned")
                    .message(abandoned.getMessage() + ". Last error: " + failure.getMessage())
                    .build());
            return FailureOutcome.ABANDONED;
        }

        RetrainingJob retry = job.withIncrementedAttempt();
        if (!retrainingQueue.putBack(retry)) {
            log.error(
                    "Retraining failed for {} (attempt {} of {}) and could not be requeued: {}",
                    modelIdentity.getKey(),
                    attemptsMade,
                    maxAttempts,
                    failure.describe());
            monitoringMetrics.recordJobOutcome("dead_lettered");
            sendAlert(Alert.builder()
                    .type(AlertType.RETRAINING_FAILED)
                    .severity(AlertSeverity.CRITICAL)
                    .modelIdentity(modelIdentity)
                    .title("Retraining failed")
                    .message("Error: " + failure.getMessage() + " (attempt " + attemptsMade + " of " + maxAttempts
                            + "). The retry could not be queued and was moved to the dead letter store.")
                    .build());
            return FailureOutcome.DEAD_LETTERED;
        }

        log.error(
                "Retraining failed for {} (attempt {} of {}), requeued: {}",
                modelIdentity.getKey(),
                attemptsMade,
                maxAttempts,
                failure.describe());
        monitoringMetrics.recordJobOutcome("requeued");
        sendAlert(Alert.builder()
                .type(AlertType.RETRAINING_FAILED)
                .severity(AlertSeverity.WARNING)
                .modelIdentity(modelIdentity)
                .title("Retraining failed")
                .message("Error: " + failure.getMessage() + " (attempt " + retry.getAttemptCount() + " of "
                        + maxAttempts + ", will retry next cycle)")
                .build());
        return FailureOutcome.REQUEUED;
    }

    private void restoreFrom(List<RetrainingJob> jobs, int fromIndex, Tally tally) {
        // The Redis client refuses commands on an interrupted thread.
        boolean interrupted = Thread.interrupted();
        try {
            int before = tally.restored;
            for (RetrainingJob job : jobs.subList(fromIndex, jobs.size())) {
                putBack(job, tally);
            }
            if (tally.restored > before) {
                log.info("Restored {} unprocessed retraining jobs to the queue", tally.restored - before);
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void putBack(RetrainingJob job, Tally tally) {
        if (retrainingQueue.putBack(job)) {
            monitoringMetrics.recordJobOutcome("restored");
            tally.restored++;
        } else {
            monitoringMetrics.recordJobOutcome("dead_lettered");
            tally.deadLettered++;
        }
    }

    private void refreshQueueDepth() {
        boolean interrupted = Thread.interrupted();
        try {
            monitoringMetrics.updateQueueDepth(retrainingQueue.size());
        } catch (RuntimeException e) {
            log.warn("Could not read retraining queue depth: {}", e.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void sendAlert(Alert alert) {
        try {
            alertNotifier.notify(alert);
        } catch (NotificationException e) {
            log.warn("Alert delivery failed, continuing: {}", e.describe());
        }
    }

    private enum FailureOutcome {
        REQUEUED,
        ABANDONED,
        DEAD_LETTERED
    }

    private static final class Tally {
        int succeeded;
        int requeued;
        int abandoned;
        int restored;
        int deadLettered;
    }
}
