package com.modelmonitor.retraining;

import com.modelmonitor.domain.enums.AlertSeverity;
import com.modelmonitor.domain.enums.AlertType;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.Issue;
import com.modelmonitor.domain.model.MonitoringResult;
import com.modelmonitor.domain.model.RetrainingJob;
import com.modelmonitor.exception.NotificationException;
import com.modelmonitor.notification.Alert;
import com.modelmonitor.notification.AlertNotifier;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns degraded monitoring results and operator requests into queued retraining jobs.
 * Alert delivery failures are logged and never prevent the job from being queued.
 */
@Service
public class RetrainingService {

    private static final Logger log = LoggerFactory.getLogger(RetrainingService.class);

    private final RetrainingQueue retrainingQueue;
    private final AlertNotifier alertNotifier;

    public RetrainingService(RetrainingQueue retrainingQueue, AlertNotifier alertNotifier) {
        this.retrainingQueue = retrainingQueue;
        this.alertNotifier = alertNotifier;
    }

    /**
     * Raises a degradation alert and queues an automatic job.
     *
     * @return the queued job, or empty if the result does not call for retraining
     */
    public Optional<RetrainingJob> requestRetraining(MonitoringResult result) {
        if (!result.isNeedsRetraining()) {
            return Optional.empty();
        }

        ModelIdentity modelIdentity = result.getModelIdentity();
        log.warn("Model {} needs retraining: {}", modelIdentity.getKey(), result.getIssues());

        sendAlert(Alert.builder()
                .type(AlertType.MODEL_DEGRADED)
                .severity(AlertSeverity.WARNING)
                .modelIdentity(modelIdentity)
                .title("Model degraded")
                .message("Issues detected: "
                        + result.getIssues().stream().map(Issue::getMessage).collect(Collectors.joining(", ")))
                .build());

        RetrainingJob job = RetrainingJob.automatic(result);
        retrainingQueue.enqueue(job);
        return Optional.of(job);
    }

    /** Queues an operator-requested job regardless of the model's current metrics. */
    public RetrainingJob requestManualRetraining(ModelIdentity modelIdentity, String reason) {
        RetrainingJob job = RetrainingJob.manual(modelIdentity, reason);
        retrainingQueue.enqueue(job);

        sendAlert(Alert.builder()
                .type(AlertType.SYSTEM)
                .severity(AlertSeverity.INFO)
                .modelIdentity(modelIdentity)
                .title("Manual retraining queued: " + modelIdentity.getKey())
                .message("Manual retraining requested for " + modelIdentity.getKey() + ": " + reason)
                .build());
        return job;
    }

    private void sendAlert(Alert alert) {
        try {
            alertNotifier.notify(alert);
        } catch (NotificationException e) {
            log.warn("Alert delivery failed, continuing: {}", e.getMessage());
        }
    }
}
