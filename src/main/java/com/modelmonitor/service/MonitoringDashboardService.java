package com.modelmonitor.service;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.domain.model.MonitoringRecord;
import com.modelmonitor.notification.AlertNotifier;
import com.modelmonitor.retraining.RetrainingQueue;
import com.modelmonitor.store.MonitoringRecordStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-only view of the monitoring state: recent cycle records, per-model health, queue depth
 * and recent alerts. A failing source is logged and shown as empty; the rest is still returned.
 */
@Service
public class MonitoringDashboardService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringDashboardService.class);

    private final MonitoringRecordStore monitoringRecordStore;
    private final ModelStatusService modelStatusService;
    private final RetrainingQueue retrainingQueue;
    private final AlertNotifier alertNotifier;
    private final MonitoringProperties monitoringProperties;

    public MonitoringDashboardService(
            MonitoringRecordStore monitoringRecordStore,
            ModelStatusService modelStatusService,
            RetrainingQueue retrainingQueue,
            AlertNotifier alertNotifier,
            MonitoringProperties monitoringProperties) {
        this.monitoringRecordStore = monitoringRecordStore;
        this.modelStatusService = modelStatusService;
        this.retrainingQueue = retrainingQueue;
        this.alertNotifier = alertNotifier;
        this.monitoringProperties = monitoringProperties;
    }

    public DashboardSnapshot getDashboard() {
        return DashboardSnapshot.builder()
                .recentMonitoring(recentRecords())
                .modelStatuses(modelStatusService.getAll())
                .retrainingQueueDepth(queueDepth())
                .recentAlerts(alertNotifier.getRecentAlerts())
                .build();
    }

    private List<MonitoringRecord> recentRecords() {
        try {
            return monitoringRecordStore.listRecent(monitoringProperties.getDashboardRecordLimit());
        } catch (RuntimeException e) {
            log.error("Failed to load recent monitoring records: {}", e.getMessage());
            return List.of();
        }
    }

    private long queueDepth() {
        try {
            return retrainingQueue.size();
        } catch (RuntimeException e) {
            log.error("Failed to read retraining queue depth: {}", e.getMessage());
            return -1L;
        }
    }
}
