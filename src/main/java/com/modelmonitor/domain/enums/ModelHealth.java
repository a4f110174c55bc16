package com.modelmonitor.domain.enums;

/**
 * Last known health of a model, kept in Redis for the dashboard.
 * UNKNOWN is only reported, never stored.
 */
public enum ModelHealth {
    HEALTHY,
    DEGRADED,
    INSUFFICIENT_DATA,
    ERROR,
    RETRAINING,
    RETRAINED,
    RETRAINING_FAILED,
    UNKNOWN
}
