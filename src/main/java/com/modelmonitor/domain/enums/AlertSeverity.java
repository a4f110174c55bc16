package com.modelmonitor.domain.enums;

/**
 * Severity level for alerts in the notification system.
 *
 * <p>Determines default channel routing:
 * <ul>
 *   <li>CRITICAL: all channels (Email + Telegram)</li>
 *   <li>WARNING: Email + Telegram</li>
 *   <li>INFO: Email only</li>
 * </ul>
 */
public enum AlertSeverity {

    /** A retraining job was abandoned; a model stays degraded until an operator steps in. */
    CRITICAL,

    /** Degradation detected or a retraining attempt failed. */
    WARNING,

    /** Informational, e.g. a successful retrain. */
    INFO
}
