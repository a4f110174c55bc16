package com.modelmonitor.notification;

import com.modelmonitor.config.NotificationProperties;
import com.modelmonitor.domain.enums.NotificationChannel;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Sends alerts via the Telegram Bot API.
 *
 * <p>Each recipient is a chat id. Messages are sent as plain text with the subject on the
 * first line. Connect and read timeouts come from
 * {@code model-monitor.notifications.telegram.*-timeout}.
 */
@Component
public class TelegramNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotificationSink.class);

    private static final String SEND_MESSAGE_PATH = "/bot%s/sendMessage";

    private final NotificationProperties notificationProperties;
    private final RestTemplate restTemplate;

    @Autowired
    public TelegramNotificationSink(
            NotificationProperties notificationProperties, RestTemplateBuilder restTemplateBuilder) {
        this(
                notificationProperties,
                restTemplateBuilder
                        .connectTimeout(notificationProperties.getTelegram().getConnectTimeout())
                        .readTimeout(notificationProperties.getTelegram().getReadTimeout())
                        .build());
    }

    public TelegramNotificationSink(NotificationProperties notificationProperties, RestTemplate restTemplate) {
        this.notificationProperties = notificationProperties;
        this.restTemplate = restTemplate;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.TELEGRAM;
    }

    @Override
    public boolean isEnabled() {
        NotificationProperties.Telegram telegram = notificationProperties.getTelegram();
        return telegram.isEnabled()
                && telegram.getBotToken() != null
                && !telegram.getBotToken().isBlank()
                && !recipients().isEmpty();
    }

    @Override
    public List<String> recipients() {
        String chatId = notificationProperties.getTelegram().getChatId();
        return chatId == null || chatId.isBlank() ? List.of() : List.of(chatId);
    }

    @Override
    public void send(List<String> recipients, String subject, String body) {
        NotificationProperties.Telegram telegram = notificationProperties.getTelegram();
        String url = telegram.getApiBaseUrl() + String.format(SEND_MESSAGE_PATH, telegram.getBotToken());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        for (String chatId : recipients) {
            Map<String, Object> payload = Map.of(
                    "chat_id", chatId,
                    "text", subject + "\n\n" + body,
                    "disable_web_page_preview", true);
            restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
        }
        log.debug("Telegram alert sent: {}", subject);
    }
}
