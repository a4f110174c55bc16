package com.modelmonitor.domain.enums;

public enum AlertType {
    MODEL_DEGRADED,
    RETRAINING_SUCCEEDED,
    RETRAINING_FAILED,
    RETRAINING_ABANDONED,
    SYSTEM
}
