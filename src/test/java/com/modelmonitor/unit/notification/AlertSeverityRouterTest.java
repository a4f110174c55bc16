package com.modelmonitor.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.modelmonitor.config.NotificationProperties;
import com.modelmonitor.domain.enums.AlertSeverity;
import com.modelmonitor.domain.enums.NotificationChannel;
import com.modelmonitor.notification.AlertSeverityRouter;
import java.util.EnumSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AlertSeverityRouter.
 *
 * <p>Verifies: default severity routing and per-severity overrides.
 */
class AlertSeverityRouterTest {

    private NotificationProperties notificationProperties;
    private AlertSeverityRouter router;

    @BeforeEach
    void setUp() {
        notificationProperties = new NotificationProperties();
        router = new AlertSeverityRouter(notificationProperties);
    }

    @Test
    void critical_routesToAllChannels() {
        assertThat(router.resolveChannels(AlertSeverity.CRITICAL))
                .containsExactlyInAnyOrder(NotificationChannel.EMAIL, NotificationChannel.TELEGRAM);
    }

    @Test
    void warning_routesToEmailAndTelegram() {
        assertThat(router.resolveChannels(AlertSeverity.WARNING))
                .containsExactlyInAnyOrder(NotificationChannel.EMAIL, NotificationChannel.TELEGRAM);
    }

    @Test
    void info_routesToEmailOnly() {
        assertThat(router.resolveChannels(AlertSeverity.INFO)).containsExactly(NotificationChannel.EMAIL);
    }

    @Test
    void override_replacesDefaultForThatSeverityOnly() {
        notificationProperties.getRouting().put(AlertSeverity.INFO, EnumSet.of(NotificationChannel.TELEGRAM));

        assertThat(router.resolveChannels(AlertSeverity.INFO)).containsExactly(NotificationChannel.TELEGRAM);
        assertThat(router.resolveChannels(AlertSeverity.WARNING)).hasSize(2);
    }

    @Test
    void emptyOverride_silencesSeverity() {
        notificationProperties.getRouting().put(AlertSeverity.INFO, EnumSet.noneOf(NotificationChannel.class));

        assertThat(router.resolveChannels(AlertSeverity.INFO)).isEmpty();
    }
}
