package com.modelmonitor.repository.jpa;

import com.modelmonitor.entity.MonitoringRecordEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MonitoringRecordJpaRepository extends JpaRepository<MonitoringRecordEntity, Long> {

    List<MonitoringRecordEntity> findAllByOrderByTimestampDesc(Pageable pageable);
}
