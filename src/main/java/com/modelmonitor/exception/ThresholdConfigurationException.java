package com.modelmonitor.exception;

import java.util.List;
import java.util.Map;

/** Thresholds are missing or invalid. Fails startup; on hot reload the previous set is kept. */
public class ThresholdConfigurationException extends BaseException {

    public ThresholdConfigurationException(List<String> violations) {
        super(
                ErrorCode.INVALID_CONFIGURATION,
                "Invalid monitoring thresholds: " + String.join("; ", violations),
                Map.of("violations", violations));
    }

    public ThresholdConfigurationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CONFIGURATION, message, cause);
    }
}
