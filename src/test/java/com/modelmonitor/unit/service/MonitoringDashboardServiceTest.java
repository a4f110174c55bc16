package com.modelmonitor.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.domain.enums.AlertSeverity;
import com.modelmonitor.domain.enums.AlertType;
import com.modelmonitor.domain.enums.ModelHealth;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.MonitoringRecord;
import com.modelmonitor.domain.model.RetrainingJob;
import com.modelmonitor.exception.PersistenceException;
import com.modelmonitor.notification.Alert;
import com.modelmonitor.notification.AlertNotifier;
import com.modelmonitor.retraining.RetrainingJobCodec;
import com.modelmonitor.retraining.RetrainingQueue;
import com.modelmonitor.service.DashboardSnapshot;
import com.modelmonitor.service.ModelStatusService;
import com.modelmonitor.service.MonitoringDashboardService;
import com.modelmonitor.store.MonitoringRecordStore;
import com.modelmonitor.support.InMemoryDurableQueue;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Unit tests for MonitoringDashboardService.
 *
 * <p>Verifies: snapshot assembly from every source and that one failing source does not
 * hide the others.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MonitoringDashboardServiceTest {

    @Mock
    private MonitoringRecordStore monitoringRecordStore;

    @Mock
    private ModelStatusService modelStatusService;

    @Mock
    private AlertNotifier alertNotifier;

    private RetrainingQueue retrainingQueue;
    private MonitoringProperties monitoringProperties;
    private MonitoringDashboardService dashboardService;

    @BeforeEach
    void setUp() {
        monitoringProperties = new MonitoringProperties();
        monitoringProperties.setDashboardRecordLimit(5);
        retrainingQueue = new RetrainingQueue(new InMemoryDurableQueue(), new RetrainingJobCodec());
        dashboardService = new MonitoringDashboardService(
                monitoringRecordStore, modelStatusService, retrainingQueue, alertNotifier, monitoringProperties);

        when(modelStatusService.getAll()).thenReturn(Map.of(ModelIdentity.PRICE_PREDICTION, ModelHealth.DEGRADED));
        when(alertNotifier.getRecentAlerts()).thenReturn(List.of(Alert.builder()
                .type(AlertType.MODEL_DEGRADED)
                .severity(AlertSeverity.WARNING)
                .modelIdentity(ModelIdentity.PRICE_PREDICTION)
                .title("Model degraded")
                .message("Issues detected: MAPE too high: 18.50%")
                .build()));
    }

    @Test
    void getDashboard_combinesAllSources() {
        MonitoringRecord record = MonitoringRecord.builder()
                .id(3L)
                .timestamp(LocalDateTime.of(2024, 3, 1, 6, 0))
                .results(Map.of())
                .build();
        when(monitoringRecordStore.listRecent(5)).thenReturn(List.of(record));
        retrainingQueue.enqueue(RetrainingJob.manual(ModelIdentity.PRICE_PREDICTION, "test"));

        DashboardSnapshot snapshot = dashboardService.getDashboard();

        assertThat(snapshot.getRecentMonitoring()).containsExactly(record);
        assertThat(snapshot.getModelStatuses()).containsEntry(ModelIdentity.PRICE_PREDICTION, ModelHealth.DEGRADED);
        assertThat(snapshot.getRetrainingQueueDepth()).isEqualTo(1);
        assertThat(snapshot.getRecentAlerts()).hasSize(1);
    }

    @Test
    void getDashboard_recordStoreDown_otherSectionsStillFilled() {
        when(monitoringRecordStore.listRecent(5)).thenThrow(new PersistenceException("db down", null));

        DashboardSnapshot snapshot = dashboardService.getDashboard();

        assertThat(snapshot.getRecentMonitoring()).isEmpty();
        assertThat(snapshot.getModelStatuses()).isNotEmpty();
        assertThat(snapshot.getRetrainingQueueDepth()).isZero();
    }
}
