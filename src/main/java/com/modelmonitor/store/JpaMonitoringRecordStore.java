package com.modelmonitor.store;

import com.modelmonitor.domain.model.MonitoringRecord;
import com.modelmonitor.entity.MonitoringRecordEntity;
import com.modelmonitor.exception.PersistenceException;
import com.modelmonitor.mapper.MonitoringRecordMapper;
import com.modelmonitor.repository.jpa.MonitoringRecordJpaRepository;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/** {@link MonitoringRecordStore} over the model_monitoring table. */
@Service
public class JpaMonitoringRecordStore implements MonitoringRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JpaMonitoringRecordStore.class);

    private final MonitoringRecordJpaRepository monitoringRecordJpaRepository;
    private final MonitoringRecordMapper monitoringRecordMapper = Mappers.getMapper(MonitoringRecordMapper.class);

    public JpaMonitoringRecordStore(MonitoringRecordJpaRepository monitoringRecordJpaRepository) {
        this.monitoringRecordJpaRepository = monitoringRecordJpaRepository;
    }

    @Override
    public MonitoringRecord append(MonitoringRecord monitoringRecord) {
        try {
            MonitoringRecordEntity entity = monitoringRecordMapper.toEntity(monitoringRecord);
            entity.setId(null);
            MonitoringRecordEntity saved = monitoringRecordJpaRepository.save(entity);
            log.info("Monitoring record stored: id={}, models={}", saved.getId(),
                    monitoringRecord.getResults().keySet());
            return monitoringRecordMapper.toDomain(saved);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to store monitoring record: " + e.getMessage(), e);
        }
    }

    @Override
    public List<MonitoringRecord> listRecent(int limit) {
        return monitoringRecordMapper.toDomainList(
                monitoringRecordJpaRepository.findAllByOrderByTimestampDesc(PageRequest.of(0, limit)));
    }
}
