package com.modelmonitor.repository.redis;

import com.modelmonitor.config.RedisConfig;
import com.modelmonitor.entity.DeadLetterJobEntity;
import com.modelmonitor.repository.jpa.DeadLetterJobJpaRepository;
import com.modelmonitor.retraining.DurableQueue;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Retraining queue stored as a Redis list.
 *
 * <p>Key format: mm:retraining:queue. LPUSH adds at the tail, RPOP removes the head, so the
 * list is consumed in insertion order. Dead-lettered payloads go to the retraining_dead_letter
 * table instead of a Redis key so they outlive a Redis flush.
 */
@Repository
@RequiredArgsConstructor
public class RedisDurableQueue implements DurableQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisDurableQueue.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final DeadLetterJobJpaRepository deadLetterJobJpaRepository;

    @Override
    public void push(String payload) {
        stringRedisTemplate.opsForList().leftPush(RedisConfig.KEY_RETRAINING_QUEUE, payload);
    }

    @Override
    public Optional<String> pop() {
        return Optional.ofNullable(stringRedisTemplate.opsForList().rightPop(RedisConfig.KEY_RETRAINING_QUEUE));
    }

    @Override
    public long size() {
        Long size = stringRedisTemplate.opsForList().size(RedisConfig.KEY_RETRAINING_QUEUE);
        return size != null ? size : 0L;
    }

    @Override
    public void deadLetter(String payload, String reason) {
        DeadLetterJobEntity entity = DeadLetterJobEntity.builder()
                .payload(payload)
                .errorMessage(reason)
                .status("PENDING")
                .createdAt(LocalDateTime.now())
                .build();
        deadLetterJobJpaRepository.save(entity);
        log.warn("Retraining payload dead-lettered: id={}, reason={}", entity.getId(), reason);
    }
}
