package com.modelmonitor.exception;

/** A queue payload is not a valid serialized retraining job. It is dead-lettered, never executed. */
public class MalformedJobPayloadException extends BaseException {

    public MalformedJobPayloadException(String message) {
        super(ErrorCode.MALFORMED_JOB_PAYLOAD, message);
    }

    public MalformedJobPayloadException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_JOB_PAYLOAD, message, cause);
    }
}
