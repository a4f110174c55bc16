package com.modelmonitor.exception;

import com.modelmonitor.domain.enums.ModelIdentity;
import java.util.Map;

/** Metrics or drift could not be computed for one model. Isolated to that model's result. */
public class EvaluationException extends BaseException {

    public EvaluationException(ModelIdentity modelIdentity, String message) {
        super(ErrorCode.EVALUATION_FAILED, message, Map.of("model", modelIdentity.getKey()));
    }

    public EvaluationException(ModelIdentity modelIdentity, String message, Throwable cause) {
        super(ErrorCode.EVALUATION_FAILED, message, Map.of("model", modelIdentity.getKey()), cause);
    }
}
