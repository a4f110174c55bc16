package com.modelmonitor.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the monitor's failures. The {@link ErrorCode} and details map travel with the
 * exception into the isolation handlers, which log them via {@link #describe()}.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    /** One-line form for logs and dead-letter reasons: {@code CODE: message {details}}. */
    public String describe() {
        String described = errorCode.getCode() + ": " + getMessage();
        return details.isEmpty() ? described : described + " " + details;
    }
}
