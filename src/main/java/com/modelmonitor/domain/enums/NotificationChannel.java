package com.modelmonitor.domain.enums;

/**
 * Delivery channels for alerts. EMAIL reaches the configured recipient list,
 * TELEGRAM the configured operations chat.
 */
public enum NotificationChannel {
    EMAIL,
    TELEGRAM
}
