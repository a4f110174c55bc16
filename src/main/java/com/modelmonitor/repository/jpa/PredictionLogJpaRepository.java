package com.modelmonitor.repository.jpa;

import com.modelmonitor.entity.PredictionLogEntity;
import jakarta.persistence.QueryHint;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

/** Read access to logged predictions. Queries are bounded by a 30s timeout hint. */
@Repository
public interface PredictionLogJpaRepository extends JpaRepository<PredictionLogEntity, Long> {

    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "30000"))
    List<PredictionLogEntity> findByModelNameAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(
            String modelName, LocalDateTime since);
}
