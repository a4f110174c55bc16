package com.modelmonitor.notification;

import com.modelmonitor.config.NotificationProperties;
import com.modelmonitor.domain.enums.NotificationChannel;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Sends alerts by email through Spring Mail.
 *
 * <p>SMTP settings come from {@code spring.mail.*}. The channel stays disabled until a sender,
 * at least one recipient and a configured mail host are present.
 */
@Component
public class EmailNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationSink.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final NotificationProperties notificationProperties;

    public EmailNotificationSink(
            ObjectProvider<JavaMailSender> mailSenderProvider, NotificationProperties notificationProperties) {
        this.mailSenderProvider = mailSenderProvider;
        this.notificationProperties = notificationProperties;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public boolean isEnabled() {
        String sender = notificationProperties.getSender();
        return sender != null
                && !sender.isBlank()
                && !recipients().isEmpty()
                && mailSenderProvider.getIfAvailable() != null;
    }

    @Override
    public List<String> recipients() {
        return notificationProperties.getRecipients().stream()
                .map(String::trim)
                .filter(recipient -> !recipient.isEmpty())
                .toList();
    }

    @Override
    public void send(List<String> recipients, String subject, String body) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            throw new IllegalStateException("No mail sender configured");
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(notificationProperties.getSender());
        message.setTo(recipients.toArray(String[]::new));
        message.setSubject(notificationProperties.getSubjectPrefix() + subject);
        message.setText(body);

        mailSender.send(message);
        log.info("Alert email sent: {}", subject);
    }
}
