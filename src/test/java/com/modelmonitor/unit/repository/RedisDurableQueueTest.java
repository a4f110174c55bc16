package com.modelmonitor.unit.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.modelmonitor.entity.DeadLetterJobEntity;
import com.modelmonitor.repository.jpa.DeadLetterJobJpaRepository;
import com.modelmonitor.repository.redis.RedisDurableQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Unit tests for RedisDurableQueue covering list direction (LPUSH tail, RPOP head),
 * empty-queue handling, and dead letters written to the database.
 */
class RedisDurableQueueTest {

    private static final String KEY = "mm:retraining:queue";

    private ListOperations<String, String> listOperations;
    private DeadLetterJobJpaRepository deadLetterJobJpaRepository;
    private RedisDurableQueue queue;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        StringRedisTemplate stringRedisTemplate = mock(StringRedisTemplate.class);
        listOperations = mock(ListOperations.class);
        deadLetterJobJpaRepository = mock(DeadLetterJobJpaRepository.class);
        when(stringRedisTemplate.opsForList()).thenReturn(listOperations);
        queue = new RedisDurableQueue(stringRedisTemplate, deadLetterJobJpaRepository);
    }

    @Test
    void push_leftPushesPayload() {
        queue.push("{\"id\":\"1\"}");

        verify(listOperations).leftPush(KEY, "{\"id\":\"1\"}");
    }

    @Test
    void pop_rightPopsHead() {
        when(listOperations.rightPop(KEY)).thenReturn("{\"id\":\"1\"}");

        assertThat(queue.pop()).contains("{\"id\":\"1\"}");
    }

    @Test
    void pop_emptyList_empty() {
        when(listOperations.rightPop(KEY)).thenReturn(null);

        assertThat(queue.pop()).isEmpty();
    }

    @Test
    void size_nullFromRedis_zero() {
        when(listOperations.size(KEY)).thenReturn(null);

        assertThat(queue.size()).isZero();
    }

    @Test
    void deadLetter_savedAsPendingEntity() {
        queue.deadLetter("garbage", "Retraining job payload is not JSON");

        ArgumentCaptor<DeadLetterJobEntity> entity = ArgumentCaptor.forClass(DeadLetterJobEntity.class);
        verify(deadLetterJobJpaRepository).save(entity.capture());
        assertThat(entity.getValue().getPayload()).isEqualTo("garbage");
        assertThat(entity.getValue().getErrorMessage()).isEqualTo("Retraining job payload is not JSON");
        assertThat(entity.getValue().getStatus()).isEqualTo("PENDING");
        assertThat(entity.getValue().getCreatedAt()).isNotNull();
    }
}
