package com.modelmonitor.config;

import com.modelmonitor.domain.enums.AlertSeverity;
import com.modelmonitor.domain.enums.NotificationChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Alert delivery configuration. Mail transport settings live under {@code spring.mail.*}.
 *
 * <pre>
 * model-monitor.notifications.sender=${SENDER_EMAIL:}
 * model-monitor.notifications.recipients=${ALERT_RECIPIENTS:}
 * model-monitor.notifications.telegram.enabled=false
 * model-monitor.notifications.telegram.bot-token=${TELEGRAM_BOT_TOKEN:}
 * model-monitor.notifications.routing.info=EMAIL
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "model-monitor.notifications")
public class NotificationProperties {

    /** From address. Email delivery is skipped while this is blank. */
    private String sender;

    private List<String> recipients = new ArrayList<>();

    private String subjectPrefix = "MkulimaLink ML Alert: ";

    private String signature = "MkulimaLink ML Team";

    /** Overrides the default severity routing. Severities not listed keep their default. */
    private Map<AlertSeverity, Set<NotificationChannel>> routing = new EnumMap<>(AlertSeverity.class);

    private Telegram telegram = new Telegram();

    @Data
    public static class Telegram {

        private boolean enabled = false;
        private String botToken;
        private String chatId;

        private String apiBaseUrl = "https://api.telegram.org";

        private Duration connectTimeout = Duration.ofSeconds(5);

        /** Applies to each sendMessage call. */
        private Duration readTimeout = Duration.ofSeconds(10);
    }
}
