package com.modelmonitor.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.enums.MonitoringStatus;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of evaluating one model in a cycle.
 *
 * <p>Only a COMPLETED result can require retraining. INSUFFICIENT_DATA and ERROR results
 * carry no metrics and are never actionable. {@code unmeasuredMetrics} lists configured
 * limits whose metric was absent: they passed, but nothing was actually measured.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitoringResult {

    ModelIdentity modelIdentity;
    MonitoringStatus status;
    int sampleCount;
    MetricSet metrics;

    @Builder.Default
    List<Issue> issues = List.of();

    @Builder.Default
    List<String> unmeasuredMetrics = List.of();

    String error;

    @Builder.Default
    LocalDateTime evaluatedAt = LocalDateTime.now();

    public boolean isNeedsRetraining() {
        return status == MonitoringStatus.COMPLETED && !issues.isEmpty();
    }

    public static MonitoringResult completed(
            ModelIdentity modelIdentity, MetricSet metrics, List<Issue> issues, List<String> unmeasuredMetrics) {
        return MonitoringResult.builder()
                .modelIdentity(modelIdentity)
                .status(MonitoringStatus.COMPLETED)
                .sampleCount(metrics.getSampleCount())
                .metrics(metrics)
                .issues(List.copyOf(issues))
                .unmeasuredMetrics(List.copyOf(unmeasuredMetrics))
                .build();
    }

    public static MonitoringResult insufficientData(ModelIdentity modelIdentity, int sampleCount) {
        return MonitoringResult.builder()
                .modelIdentity(modelIdentity)
                .status(MonitoringStatus.INSUFFICIENT_DATA)
                .sampleCount(sampleCount)
                .build();
    }

    public static MonitoringResult error(ModelIdentity modelIdentity, String error) {
        return MonitoringResult.builder()
                .modelIdentity(modelIdentity)
                .status(MonitoringStatus.ERROR)
                .error(error)
                .build();
    }
}
