package com.modelmonitor.domain.model;

import com.modelmonitor.domain.enums.ModelIdentity;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Append-only snapshot of one monitoring cycle, used for the dashboard and audit.
 * {@code id} is assigned by the store on append.
 */
@Value
@Builder
public class MonitoringRecord {

    Long id;
    LocalDateTime timestamp;
    Map<ModelIdentity, MonitoringResult> results;
}
