package com.modelmonitor.notification;

import com.modelmonitor.config.NotificationProperties;
import com.modelmonitor.domain.enums.AlertSeverity;
import com.modelmonitor.domain.enums.NotificationChannel;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Determines which notification channels to use for a given alert.
 *
 * <p>Default routing by severity:
 * <ul>
 *   <li>CRITICAL: All channels (Email + Telegram)</li>
 *   <li>WARNING: Email + Telegram</li>
 *   <li>INFO: Email only</li>
 * </ul>
 *
 * <p>{@code model-monitor.notifications.routing} overrides these defaults per severity.
 * An empty override silences that severity.
 */
@Component
public class AlertSeverityRouter {

    private static final Logger log = LoggerFactory.getLogger(AlertSeverityRouter.class);

    private static final Map<AlertSeverity, Set<NotificationChannel>> DEFAULT_ROUTING = Map.of(
            AlertSeverity.CRITICAL, EnumSet.allOf(NotificationChannel.class),
            AlertSeverity.WARNING, EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.TELEGRAM),
            AlertSeverity.INFO, EnumSet.of(NotificationChannel.EMAIL));

    private final NotificationProperties notificationProperties;

    public AlertSeverityRouter(NotificationProperties notificationProperties) {
        this.notificationProperties = notificationProperties;
    }

    public Set<NotificationChannel> resolveChannels(AlertSeverity severity) {
        Set<NotificationChannel> override = notificationProperties.getRouting().get(severity);
        if (override != null) {
            log.debug("Routing override for {}: {}", severity, override);
            return override;
        }
        return DEFAULT_ROUTING.getOrDefault(severity, EnumSet.of(NotificationChannel.EMAIL));
    }
}
