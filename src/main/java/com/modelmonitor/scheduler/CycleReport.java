package com.modelmonitor.scheduler;

import com.modelmonitor.domain.model.MonitoringRecord;
import com.modelmonitor.retraining.DrainSummary;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** What one monitoring cycle did. {@code persisted} is false when the record write failed. */
@Value
@Builder
public class CycleReport {

    MonitoringRecord monitoringRecord;
    boolean persisted;
    int retrainingRequested;
    DrainSummary drainSummary;
    Duration duration;
}
