package com.modelmonitor.domain.model;

import com.modelmonitor.domain.enums.TrainingStatus;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** What the external training pipeline reports back for one run. */
@Value
@Builder
@Jacksonized
public class TrainingResult {

    TrainingStatus status;

    @Builder.Default
    Map<String, Double> metrics = Map.of();

    String error;

    public boolean isSuccess() {
        return status == TrainingStatus.SUCCESS;
    }

    public static TrainingResult success(Map<String, Double> metrics) {
        return TrainingResult.builder().status(TrainingStatus.SUCCESS).metrics(metrics).build();
    }

    public static TrainingResult error(String error) {
        return TrainingResult.builder().status(TrainingStatus.ERROR).error(error).build();
    }
}
