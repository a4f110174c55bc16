package com.modelmonitor.notification;

import com.modelmonitor.domain.enums.NotificationChannel;
import java.util.List;

/** One delivery channel for rendered alerts. */
public interface NotificationSink {

    NotificationChannel channel();

    /** Whether the channel is configured well enough to attempt delivery. */
    boolean isEnabled();

    /** Recipients configured for this channel. */
    List<String> recipients();

    /**
     * Delivers one message.
     *
     * @throws RuntimeException on any delivery failure
     */
    void send(List<String> recipients, String subject, String body);
}
