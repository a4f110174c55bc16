package com.modelmonitor.store;

import com.modelmonitor.domain.model.MonitoringRecord;
import java.util.List;

/** Append-only history of monitoring cycles. */
public interface MonitoringRecordStore {

    /**
     * Appends a record.
     *
     * @return the stored record, with its id assigned
     * @throws com.modelmonitor.exception.PersistenceException if the write fails
     */
    MonitoringRecord append(MonitoringRecord monitoringRecord);

    /** Most recent records first. */
    List<MonitoringRecord> listRecent(int limit);
}
