package com.modelmonitor.repository.redis;

import com.modelmonitor.config.RedisConfig;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.FeatureBaseline;
import com.modelmonitor.drift.BaselineStore;
import com.modelmonitor.exception.PersistenceException;
import com.modelmonitor.mapper.JsonHelper;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis repository for frozen feature baselines.
 *
 * <p>Key format: mm:baseline:{modelKey}. Value: FeatureBaseline JSON, no TTL.
 * First capture uses SETNX so two concurrent cycles cannot both write a baseline.
 */
@Repository
@RequiredArgsConstructor
public class RedisBaselineStore implements BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(RedisBaselineStore.class);

    private final StringRedisTemplate stringRedisTemplate;

    @Override
    public Optional<FeatureBaseline> find(ModelIdentity modelIdentity) {
        String json = stringRedisTemplate.opsForValue().get(key(modelIdentity));
        return Optional.ofNullable(JsonHelper.fromJson(json, FeatureBaseline.class));
    }

    @Override
    public boolean createIfAbsent(FeatureBaseline baseline) {
        try {
            Boolean created = stringRedisTemplate
                    .opsForValue()
                    .setIfAbsent(key(baseline.getModelIdentity()), JsonHelper.toJson(baseline));
            return Boolean.TRUE.equals(created);
        } catch (DataAccessException e) {
            throw new PersistenceException(
                    "Failed to store baseline for " + baseline.getModelIdentity().getKey(), e);
        }
    }

    @Override
    public void replace(FeatureBaseline baseline) {
        try {
            stringRedisTemplate.opsForValue().set(key(baseline.getModelIdentity()), JsonHelper.toJson(baseline));
            log.info("Baseline replaced for {}", baseline.getModelIdentity().getKey());
        } catch (DataAccessException e) {
            throw new PersistenceException(
                    "Failed to replace baseline for " + baseline.getModelIdentity().getKey(), e);
        }
    }

    private String key(ModelIdentity modelIdentity) {
        return RedisConfig.KEY_PREFIX_BASELINE + modelIdentity.getKey();
    }
}
