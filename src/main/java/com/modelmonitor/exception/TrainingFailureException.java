package com.modelmonitor.exception;

import com.modelmonitor.domain.enums.ModelIdentity;
import java.util.Map;

/** The trainer reported an error, threw, or ran past its time box. The job is requeued. */
public class TrainingFailureException extends BaseException {

    public TrainingFailureException(ModelIdentity modelIdentity, String message) {
        super(ErrorCode.TRAINING_FAILED, message, Map.of("model", modelIdentity.getKey()));
    }

    public TrainingFailureException(ModelIdentity modelIdentity, String message, Throwable cause) {
        super(ErrorCode.TRAINING_FAILED, message, Map.of("model", modelIdentity.getKey()), cause);
    }
}
