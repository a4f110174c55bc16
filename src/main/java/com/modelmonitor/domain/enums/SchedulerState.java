package com.modelmonitor.domain.enums;

/**
 * States of the monitoring loop. A healthy loop cycles
 * IDLE -> EVALUATING -> PERSISTING -> DRAINING_QUEUE -> IDLE; BACKOFF is entered when
 * a failure escapes every phase-local guard.
 */
public enum SchedulerState {
    IDLE,
    EVALUATING,
    PERSISTING,
    DRAINING_QUEUE,
    BACKOFF,
    STOPPED
}
