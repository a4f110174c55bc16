package com.modelmonitor.exception;

/** Writing a monitoring record or a baseline failed. Logged; the cycle carries on. */
public class PersistenceException extends BaseException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED, message, cause);
    }
}
