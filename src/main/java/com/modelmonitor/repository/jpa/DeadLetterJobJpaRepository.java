package com.modelmonitor.repository.jpa;

import com.modelmonitor.entity.DeadLetterJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeadLetterJobJpaRepository extends JpaRepository<DeadLetterJobEntity, Long> {

    long countByStatus(String status);
}
