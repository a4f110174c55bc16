package com.modelmonitor.service;

import com.modelmonitor.domain.enums.ModelHealth;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.MonitoringRecord;
import com.modelmonitor.notification.Alert;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DashboardSnapshot {

    List<MonitoringRecord> recentMonitoring;
    Map<ModelIdentity, ModelHealth> modelStatuses;
    long retrainingQueueDepth;
    List<Alert> recentAlerts;
}
