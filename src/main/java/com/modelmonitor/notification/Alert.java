package com.modelmonitor.notification;

import com.modelmonitor.domain.enums.AlertSeverity;
import com.modelmonitor.domain.enums.AlertType;
import com.modelmonitor.domain.enums.ModelIdentity;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An operator-facing alert raised by the monitoring loop.
 *
 * <p>Alerts are created on degradation, retraining outcomes and loop failures, and routed
 * to channels (Email, Telegram) by severity. {@code modelIdentity} is null for system alerts.
 */
@Data
@Builder
public class Alert {

    private AlertType type;
    private AlertSeverity severity;
    private ModelIdentity modelIdentity;
    private String title;
    private String message;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
