package com.modelmonitor.repository.redis;

import com.modelmonitor.config.RedisConfig;
import com.modelmonitor.domain.enums.ModelHealth;
import com.modelmonitor.domain.enums.ModelIdentity;
import java.util.EnumMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Last known health of each model.
 *
 * <p>Key format: mm:model:status:{modelKey}. Value: ModelHealth name.
 */
@Repository
@RequiredArgsConstructor
public class ModelStatusRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelStatusRedisRepository.class);

    private final StringRedisTemplate stringRedisTemplate;

    public void save(ModelIdentity modelIdentity, ModelHealth health) {
        stringRedisTemplate.opsForValue().set(RedisConfig.KEY_PREFIX_MODEL_STATUS + modelIdentity.getKey(),
                health.name());
        log.debug("Model status updated: model={}, status={}", modelIdentity.getKey(), health);
    }

    /** Returns UNKNOWN when no status was recorded or the stored value is unrecognized. */
    public ModelHealth find(ModelIdentity modelIdentity) {
        String value = stringRedisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_MODEL_STATUS + modelIdentity.getKey());
        if (value == null) {
            return ModelHealth.UNKNOWN;
        }
        try {
            return ModelHealth.valueOf(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unrecognized status '{}' stored for {}", value, modelIdentity.getKey());
            return ModelHealth.UNKNOWN;
        }
    }

    public Map<ModelIdentity, ModelHealth> findAll() {
        Map<ModelIdentity, ModelHealth> statuses = new EnumMap<>(ModelIdentity.class);
        for (ModelIdentity identity : ModelIdentity.values()) {
            statuses.put(identity, find(identity));
        }
        return statuses;
    }
}
