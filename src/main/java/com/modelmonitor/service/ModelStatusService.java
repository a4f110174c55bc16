package com.modelmonitor.service;

import com.modelmonitor.domain.enums.ModelHealth;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.MonitoringResult;
import com.modelmonitor.repository.redis.ModelStatusRedisRepository;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks the last known health of each model for the dashboard.
 * Status writes are best effort: a Redis failure is logged and never fails the caller.
 */
@Service
public class ModelStatusService {

    private static final Logger log = LoggerFactory.getLogger(ModelStatusService.class);

    private final ModelStatusRedisRepository modelStatusRedisRepository;

    public ModelStatusService(ModelStatusRedisRepository modelStatusRedisRepository) {
        this.modelStatusRedisRepository = modelStatusRedisRepository;
    }

    public void update(ModelIdentity modelIdentity, ModelHealth health) {
        try {
            modelStatusRedisRepository.save(modelIdentity, health);
        } catch (RuntimeException e) {
            log.warn("Failed to record status {} for {}: {}", health, modelIdentity.getKey(), e.getMessage());
        }
    }

    public void updateFrom(MonitoringResult result) {
        update(result.getModelIdentity(), healthOf(result));
    }

    public Map<ModelIdentity, ModelHealth> getAll() {
        try {
            return modelStatusRedisRepository.findAll();
        } catch (RuntimeException e) {
            log.warn("Failed to read model statuses: {}", e.getMessage());
            Map<ModelIdentity, ModelHealth> unknown = new EnumMap<>(ModelIdentity.class);
            for (ModelIdentity identity : ModelIdentity.values()) {
                unknown.put(identity, ModelHealth.UNKNOWN);
            }
            return unknown;
        }
    }

    static ModelHealth healthOf(MonitoringResult result) {
        return switch (result.getStatus()) {
            case COMPLETED -> result.isNeedsRetraining() ? ModelHealth.DEGRADED : ModelHealth.HEALTHY;
            case INSUFFICIENT_DATA -> ModelHealth.INSUFFICIENT_DATA;
            case ERROR -> ModelHealth.ERROR;
        };
    }
}
