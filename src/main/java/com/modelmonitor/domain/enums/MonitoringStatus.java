package com.modelmonitor.domain.enums;

/** Outcome of evaluating one model in one monitoring cycle. */
public enum MonitoringStatus {
    COMPLETED,
    INSUFFICIENT_DATA,
    ERROR
}
