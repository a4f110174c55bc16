package com.modelmonitor.domain.enums;

public enum RetrainingTrigger {
    AUTOMATIC,
    MANUAL
}
