package com.modelmonitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis configuration. Values are JSON strings produced by our own codecs, so a plain
 * {@link StringRedisTemplate} is used throughout.
 *
 * <p>All keys are prefixed with "mm:" because the Redis server is shared.
 *
 * <p>Key schema:
 * <pre>
 *   mm:retraining:queue          → List of serialized retraining jobs (LPUSH tail, RPOP head)
 *   mm:baseline:{modelKey}       → FeatureBaseline JSON (written with SETNX)
 *   mm:model:status:{modelKey}   → ModelHealth name
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "mm:";

    public static final String KEY_RETRAINING_QUEUE = KEY_PREFIX + "retraining:queue";
    public static final String KEY_PREFIX_BASELINE = KEY_PREFIX + "baseline:";
    public static final String KEY_PREFIX_MODEL_STATUS = KEY_PREFIX + "model:status:";

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
        return new StringRedisTemplate(redisConnectionFactory);
    }
}
