package com.modelmonitor.notification;

import com.modelmonitor.domain.enums.NotificationChannel;
import com.modelmonitor.exception.NotificationException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Routes alerts to their channels.
 *
 * <p>Every resolved channel is attempted even if an earlier one fails. Channels that are not
 * configured are skipped. If any attempted channel fails, a {@link NotificationException}
 * naming the failed channels is thrown once all have been tried.
 *
 * <p>The last {@value #RECENT_ALERT_LIMIT} alerts are kept in memory for the dashboard.
 */
@Service
public class AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(AlertNotifier.class);

    static final int RECENT_ALERT_LIMIT = 20;

    private final AlertSeverityRouter alertSeverityRouter;
    private final NotificationTemplateEngine notificationTemplateEngine;
    private final Map<NotificationChannel, NotificationSink> sinks = new EnumMap<>(NotificationChannel.class);
    private final Deque<Alert> recentAlerts = new ConcurrentLinkedDeque<>();

    public AlertNotifier(
            AlertSeverityRouter alertSeverityRouter,
            NotificationTemplateEngine notificationTemplateEngine,
            List<NotificationSink> notificationSinks) {
        this.alertSeverityRouter = alertSeverityRouter;
        this.notificationTemplateEngine = notificationTemplateEngine;
        for (NotificationSink sink : notificationSinks) {
            sinks.put(sink.channel(), sink);
        }
    }

    public void notify(Alert alert) {
        remember(alert);

        Set<NotificationChannel> channels = alertSeverityRouter.resolveChannels(alert.getSeverity());
        if (channels.isEmpty()) {
            log.debug("No channels enabled for alert: {} ({})", alert.getType(), alert.getSeverity());
            return;
        }

        String subject = notificationTemplateEngine.renderSubject(alert);
        String body = notificationTemplateEngine.renderBody(alert);

        List<NotificationChannel> failed = new ArrayList<>();
        RuntimeException firstFailure = null;

        for (NotificationChannel channel : channels) {
            NotificationSink sink = sinks.get(channel);
            if (sink == null || !sink.isEnabled()) {
                log.warn("{} channel not configured, skipping alert: {}", channel, subject);
                continue;
            }
            try {
                sink.send(sink.recipients(), subject, body);
            } catch (RuntimeException e) {
                log.error("Failed to send notification via {}: {}", channel, e.getMessage());
                failed.add(channel);
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        if (!failed.isEmpty()) {
            throw new NotificationException(subject, failed, firstFailure);
        }
    }

    /** Most recent alerts first. */
    public List<Alert> getRecentAlerts() {
        return List.copyOf(recentAlerts);
    }

    private void remember(Alert alert) {
        recentAlerts.addFirst(alert);
        while (recentAlerts.size() > RECENT_ALERT_LIMIT) {
            recentAlerts.pollLast();
        }
    }
}
