package com.modelmonitor.repository.jpa;

import com.modelmonitor.entity.FeatureSampleEntity;
import jakarta.persistence.QueryHint;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

@Repository
public interface FeatureSampleJpaRepository extends JpaRepository<FeatureSampleEntity, Long> {

    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "30000"))
    List<FeatureSampleEntity> findByModelNameAndCreatedAtGreaterThanEqual(String modelName, LocalDateTime since);
}
