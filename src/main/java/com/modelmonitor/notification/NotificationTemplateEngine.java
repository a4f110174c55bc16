package com.modelmonitor.notification;

import com.modelmonitor.config.NotificationProperties;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * Renders alert subjects and plain-text bodies shared by all channels.
 *
 * <p>The body layout is a header line, the alert message, the timestamp, a pointer to the
 * monitoring dashboard and the team signature.
 */
@Component
public class NotificationTemplateEngine {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final NotificationProperties notificationProperties;

    public NotificationTemplateEngine(NotificationProperties notificationProperties) {
        this.notificationProperties = notificationProperties;
    }

    public String renderSubject(Alert alert) {
        return switch (alert.getType()) {
            case MODEL_DEGRADED -> "Model Retraining Required: " + modelKey(alert);
            case RETRAINING_SUCCEEDED -> "Model Retrained: " + modelKey(alert);
            case RETRAINING_FAILED -> "Model Retraining Failed: " + modelKey(alert);
            case RETRAINING_ABANDONED -> "Model Retraining Abandoned: " + modelKey(alert);
            case SYSTEM -> alert.getTitle();
        };
    }

    public String renderBody(Alert alert) {
        return String.format(
                "MkulimaLink ML Monitoring Alert%n%n"
                        + "%s%n%n"
                        + "Severity: %s%n"
                        + "Timestamp: %s%n%n"
                        + "Please check the ML monitoring dashboard for details.%n%n"
                        + "Best regards,%n"
                        + "%s%n",
                alert.getMessage(),
                alert.getSeverity(),
                alert.getTimestamp().format(TIMESTAMP_FORMAT),
                notificationProperties.getSignature());
    }

    private String modelKey(Alert alert) {
        return alert.getModelIdentity() != null ? alert.getModelIdentity().getKey() : alert.getTitle();
    }
}
