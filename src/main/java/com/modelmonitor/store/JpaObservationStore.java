package com.modelmonitor.store;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.FeatureWindow;
import com.modelmonitor.domain.model.ObservationBatch;
import com.modelmonitor.entity.FeatureSampleEntity;
import com.modelmonitor.entity.PredictionLogEntity;
import com.modelmonitor.exception.EvaluationException;
import com.modelmonitor.mapper.ObservationMapper;
import com.modelmonitor.repository.jpa.FeatureSampleJpaRepository;
import com.modelmonitor.repository.jpa.PredictionLogJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link ObservationStore} over the model_predictions and model_features tables. */
@Service
public class JpaObservationStore implements ObservationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaObservationStore.class);

    private final PredictionLogJpaRepository predictionLogJpaRepository;
    private final FeatureSampleJpaRepository featureSampleJpaRepository;
    private final ObservationMapper observationMapper = Mappers.getMapper(ObservationMapper.class);

    public JpaObservationStore(
            PredictionLogJpaRepository predictionLogJpaRepository,
            FeatureSampleJpaRepository featureSampleJpaRepository) {
        this.predictionLogJpaRepository = predictionLogJpaRepository;
        this.featureSampleJpaRepository = featureSampleJpaRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public ObservationBatch fetchPredictions(ModelIdentity modelIdentity, int windowDays) {
        LocalDateTime since = LocalDateTime.now().minusDays(windowDays);
        try {
            List<PredictionLogEntity> rows =
                    predictionLogJpaRepository.findByModelNameAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(
                            modelIdentity.getKey(), since);
            log.debug("Fetched {} predictions for {} since {}", rows.size(), modelIdentity.getKey(), since);
            return ObservationBatch.of(modelIdentity, windowDays, observationMapper.toDomainList(rows));
        } catch (DataAccessException e) {
            throw new EvaluationException(modelIdentity, "Failed to fetch predictions: " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public FeatureWindow fetchFeatureWindow(ModelIdentity modelIdentity, int windowDays) {
        LocalDateTime since = LocalDateTime.now().minusDays(windowDays);
        try {
            List<FeatureSampleEntity> rows =
                    featureSampleJpaRepository.findByModelNameAndCreatedAtGreaterThanEqual(modelIdentity.getKey(), since);

            Map<String, List<Double>> samples = new LinkedHashMap<>();
            for (FeatureSampleEntity row : rows) {
                samples.computeIfAbsent(row.getFeatureName(), k -> new ArrayList<>()).add(row.getFeatureValue());
            }
            log.debug("Fetched {} feature samples across {} features for {}", rows.size(), samples.size(),
                    modelIdentity.getKey());
            return new FeatureWindow(modelIdentity, windowDays, samples);
        } catch (DataAccessException e) {
            throw new EvaluationException(modelIdentity, "Failed to fetch feature window: " + e.getMessage(), e);
        }
    }
}
