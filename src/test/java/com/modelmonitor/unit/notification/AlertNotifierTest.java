package com.modelmonitor.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.modelmonitor.config.NotificationProperties;
import com.modelmonitor.domain.enums.AlertSeverity;
import com.modelmonitor.domain.enums.AlertType;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.enums.NotificationChannel;
import com.modelmonitor.exception.NotificationException;
import com.modelmonitor.notification.Alert;
import com.modelmonitor.notification.AlertNotifier;
import com.modelmonitor.notification.AlertSeverityRouter;
import com.modelmonitor.notification.NotificationTemplateEngine;
import com.modelmonitor.support.RecordingNotificationSink;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AlertNotifier.
 *
 * <p>Verifies: severity routing to sinks, all channels attempted when one fails,
 * missing channels skipped, and the bounded recent-alert history.
 */
class AlertNotifierTest {

    private NotificationProperties notificationProperties;
    private RecordingNotificationSink email;
    private RecordingNotificationSink telegram;

    @BeforeEach
    void setUp() {
        notificationProperties = new NotificationProperties();
        email = new RecordingNotificationSink(NotificationChannel.EMAIL);
        telegram = new RecordingNotificationSink(NotificationChannel.TELEGRAM);
    }

    private AlertNotifier notifier(RecordingNotificationSink... sinks) {
        return new AlertNotifier(
                new AlertSeverityRouter(notificationProperties),
                new NotificationTemplateEngine(notificationProperties),
                List.of(sinks));
    }

    private Alert alert(AlertSeverity severity) {
        return Alert.builder()
                .type(AlertType.RETRAINING_FAILED)
                .severity(severity)
                .modelIdentity(ModelIdentity.DISEASE_DETECTION)
                .title("Retraining failed")
                .message("Error: no data")
                .build();
    }

    @Test
    void info_sentByEmailOnly() {
        notifier(email, telegram).notify(alert(AlertSeverity.INFO));

        assertThat(email.getSubjects()).containsExactly("Model Retraining Failed: disease_detection");
        assertThat(telegram.getSubjects()).isEmpty();
    }

    @Test
    void critical_sentToEveryChannel() {
        notifier(email, telegram).notify(alert(AlertSeverity.CRITICAL));

        assertThat(email.getSubjects()).hasSize(1);
        assertThat(telegram.getSubjects()).hasSize(1);
    }

    @Test
    void failingChannel_otherChannelsStillAttempted() {
        RecordingNotificationSink failingEmail = new RecordingNotificationSink(NotificationChannel.EMAIL).failing();
        AlertNotifier notifier = notifier(failingEmail, telegram);

        assertThatThrownBy(() -> notifier.notify(alert(AlertSeverity.WARNING)))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("EMAIL");
        assertThat(telegram.getSubjects()).hasSize(1);
    }

    @Test
    void unconfiguredChannel_skippedWithoutFailure() {
        notifier(email).notify(alert(AlertSeverity.CRITICAL));

        assertThat(email.getSubjects()).hasSize(1);
    }

    @Test
    void silencedSeverity_sendsNothingButIsRemembered() {
        notificationProperties.getRouting().put(AlertSeverity.INFO, EnumSet.noneOf(NotificationChannel.class));
        AlertNotifier notifier = notifier(email, telegram);

        notifier.notify(alert(AlertSeverity.INFO));

        assertThat(email.getSubjects()).isEmpty();
        assertThat(notifier.getRecentAlerts()).hasSize(1);
    }

    @Test
    void recentAlerts_newestFirstAndBounded() {
        AlertNotifier notifier = notifier(email);
        for (int i = 0; i < 25; i++) {
            notifier.notify(Alert.builder()
                    .type(AlertType.SYSTEM)
                    .severity(AlertSeverity.INFO)
                    .title("alert " + i)
                    .message("m")
                    .build());
        }

        List<Alert> recent = notifier.getRecentAlerts();

        assertThat(recent).hasSize(20);
        assertThat(recent.get(0).getTitle()).isEqualTo("alert 24");
        assertThat(recent.get(19).getTitle()).isEqualTo("alert 5");
    }
}
