package com.modelmonitor.exception;

import com.modelmonitor.domain.model.RetrainingJob;
import java.util.Map;
import lombok.Getter;

/** Terminal state of a retraining job: it failed on every allowed attempt and is dropped. */
@Getter
public class MaxAttemptsExceededException extends BaseException {

    private final RetrainingJob job;

    public MaxAttemptsExceededException(RetrainingJob job, int maxAttempts, Throwable lastFailure) {
        super(
                ErrorCode.MAX_ATTEMPTS_EXCEEDED,
                "Retraining of " + job.getModelIdentity().getKey() + " abandoned after " + maxAttempts + " attempts",
                Map.of("jobId", job.getId(), "model", job.getModelIdentity().getKey(), "maxAttempts", maxAttempts),
                lastFailure);
        this.job = job;
    }
}
