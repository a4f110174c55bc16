package com.modelmonitor.exception;

import com.modelmonitor.domain.enums.NotificationChannel;
import java.util.List;
import java.util.Map;

/**
 * One or more channels failed to deliver an alert. Never fails the operation that raised
 * the alert: call sites log and continue.
 */
public class NotificationException extends BaseException {

    public NotificationException(String message, Throwable cause) {
        super(ErrorCode.NOTIFICATION_FAILED, message, cause);
    }

    public NotificationException(String subject, List<NotificationChannel> failedChannels, Throwable cause) {
        super(
                ErrorCode.NOTIFICATION_FAILED,
                "Alert '" + subject + "' failed on " + failedChannels,
                Map.of("failedChannels", failedChannels),
                cause);
    }
}
