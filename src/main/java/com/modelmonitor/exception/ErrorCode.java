package com.modelmonitor.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INSUFFICIENT_DATA("INSUFFICIENT_DATA"),
    EVALUATION_FAILED("EVALUATION_FAILED"),
    PERSISTENCE_FAILED("PERSISTENCE_FAILED"),
    NOTIFICATION_FAILED("NOTIFICATION_FAILED"),
    TRAINING_FAILED("TRAINING_FAILED"),
    MAX_ATTEMPTS_EXCEEDED("MAX_ATTEMPTS_EXCEEDED"),
    MALFORMED_JOB_PAYLOAD("MALFORMED_JOB_PAYLOAD"),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION");

    private final String code;
}
