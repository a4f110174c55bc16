package com.modelmonitor.domain.model;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.enums.RetrainingTrigger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * A queued request to retrain one model. The only state that changes over the job's
 * life is {@code attemptCount}, and only through {@link #withIncrementedAttempt()}.
 */
@Value
@Builder(toBuilder = true)
public class RetrainingJob {

    String id;
    ModelIdentity modelIdentity;
    RetrainingTrigger trigger;
    List<String> issues;
    Map<String, Double> metrics;
    Instant enqueuedAt;
    int attemptCount;

    public static RetrainingJob automatic(MonitoringResult result) {
        return RetrainingJob.builder()
                .id(UUID.randomUUID().toString())
                .modelIdentity(result.getModelIdentity())
                .trigger(RetrainingTrigger.AUTOMATIC)
                .issues(result.getIssues().stream().map(Issue::getMessage).toList())
                .metrics(result.getMetrics() != null ? result.getMetrics().asMap() : Map.of())
                .enqueuedAt(Instant.now())
                .attemptCount(0)
                .build();
    }

    public static RetrainingJob manual(ModelIdentity modelIdentity, String reason) {
        return RetrainingJob.builder()
                .id(UUID.randomUUID().toString())
                .modelIdentity(modelIdentity)
                .trigger(RetrainingTrigger.MANUAL)
                .issues(List.of("Manual retraining requested: " + reason))
                .metrics(Map.of())
                .enqueuedAt(Instant.now())
                .attemptCount(0)
                .build();
    }

    public RetrainingJob withIncrementedAttempt() {
        return toBuilder().attemptCount(attemptCount + 1).build();
    }
}
