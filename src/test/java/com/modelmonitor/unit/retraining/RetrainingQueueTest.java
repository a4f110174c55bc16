package com.modelmonitor.unit.retraining;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.RetrainingJob;
import com.modelmonitor.retraining.DurableQueue;
import com.modelmonitor.retraining.RetrainingJobCodec;
import com.modelmonitor.retraining.RetrainingQueue;
import com.modelmonitor.support.InMemoryDurableQueue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

/**
 * Unit tests for RetrainingQueue.
 *
 * <p>Verifies: FIFO order, put-back semantics, dead-lettering of malformed payloads and of
 * jobs that cannot be pushed back, partial reads, and that a drain terminates even while
 * producers keep pushing.
 */
class RetrainingQueueTest {

    private final RetrainingJobCodec codec = new RetrainingJobCodec();
    private InMemoryDurableQueue durableQueue;
    private RetrainingQueue retrainingQueue;

    @BeforeEach
    void setUp() {
        durableQueue = new InMemoryDurableQueue();
        retrainingQueue = new RetrainingQueue(durableQueue, codec);
    }

    @Test
    void dequeueAll_returnsJobsInEnqueueOrder() {
        RetrainingJob first = RetrainingJob.manual(ModelIdentity.PRICE_PREDICTION, "first");
        RetrainingJob second = RetrainingJob.manual(ModelIdentity.DISEASE_DETECTION, "second");
        RetrainingJob third = RetrainingJob.manual(ModelIdentity.RECOMMENDATION, "third");
        retrainingQueue.enqueue(first);
        retrainingQueue.enqueue(second);
        retrainingQueue.enqueue(third);

        List<RetrainingJob> jobs = retrainingQueue.dequeueAll();

        assertThat(jobs).extracting(RetrainingJob::getId).containsExactly(first.getId(), second.getId(), third.getId());
        assertThat(retrainingQueue.size()).isZero();
    }

    @Test
    void putBack_retryAppendsAtTailWithIncrementedAttempt() {
        RetrainingJob failed = RetrainingJob.manual(ModelIdentity.PRICE_PREDICTION, "failed");
        RetrainingJob waiting = RetrainingJob.manual(ModelIdentity.DISEASE_DETECTION, "waiting");
        retrainingQueue.enqueue(waiting);

        assertThat(retrainingQueue.putBack(failed.withIncrementedAttempt())).isTrue();

        assertThat(retrainingQueue.dequeueAll())
                .extracting(RetrainingJob::getId, RetrainingJob::getAttemptCount)
                .containsExactly(
                        tuple(waiting.getId(), 0),
                        tuple(failed.getId(), 1));
    }

    @Test
    void putBack_keepsJobUnchanged() {
        RetrainingJob job = RetrainingJob.manual(ModelIdentity.RECOMMENDATION, "shutdown").withIncrementedAttempt();

        retrainingQueue.putBack(job);

        assertThat(retrainingQueue.dequeueAll()).containsExactly(job);
    }

    @Test
    void malformedPayload_deadLetteredAndSkipped() {
        RetrainingJob job = RetrainingJob.manual(ModelIdentity.PRICE_PREDICTION, "ok");
        durableQueue.push("{'model_name': 'price_prediction'}");
        retrainingQueue.enqueue(job);

        List<RetrainingJob> jobs = retrainingQueue.dequeueAll();

        assertThat(jobs).containsExactly(job);
        assertThat(durableQueue.getDeadLetters()).containsExactly("{'model_name': 'price_prediction'}");
    }

    @Test
    void dequeueAll_boundedBySizeAtStart() {
        String payload = codec.encode(RetrainingJob.manual(ModelIdentity.PRICE_PREDICTION, "endless"));
        AtomicInteger pops = new AtomicInteger();
        DurableQueue endless = new DurableQueue() {
            @Override
            public void push(String ignored) {}

            @Override
            public Optional<String> pop() {
                pops.incrementAndGet();
                return Optional.of(payload);
            }

            @Override
            public long size() {
                return 3;
            }

            @Override
            public void deadLetter(String ignored, String reason) {}
        };

        List<RetrainingJob> jobs = new RetrainingQueue(endless, codec).dequeueAll();

        assertThat(jobs).hasSize(3);
        assertThat(pops).hasValue(3);
    }

    @Test
    void putBack_pushFails_deadLettersPayloadWithoutThrowing() {
        RetrainingJob job = RetrainingJob.manual(ModelIdentity.PRICE_PREDICTION, "retry");
        InMemoryDurableQueue unreachable = new InMemoryDurableQueue() {
            @Override
            public synchronized void push(String payload) {
                throw new RedisConnectionFailureException("redis down");
            }
        };

        boolean queued = new RetrainingQueue(unreachable, codec).putBack(job);

        assertThat(queued).isFalse();
        assertThat(unreachable.getDeadLetters()).singleElement().satisfies(payload -> assertThat(codec.decode(payload))
                .isEqualTo(job));
    }

    @Test
    void putBack_pushAndDeadLetterFail_returnsFalse() {
        DurableQueue down = new DurableQueue() {
            @Override
            public void push(String payload) {
                throw new RedisConnectionFailureException("redis down");
            }

            @Override
            public Optional<String> pop() {
                return Optional.empty();
            }

            @Override
            public long size() {
                return 0;
            }

            @Override
            public void deadLetter(String payload, String reason) {
                throw new IllegalStateException("database down");
            }
        };

        boolean queued = new RetrainingQueue(down, codec)
                .putBack(RetrainingJob.manual(ModelIdentity.RECOMMENDATION, "lost"));

        assertThat(queued).isFalse();
    }

    @Test
    void dequeueAll_readFailsPartWay_returnsJobsAlreadyRemoved() {
        List<String> payloads = new ArrayList<>(List.of(
                codec.encode(RetrainingJob.manual(ModelIdentity.PRICE_PREDICTION, "first")),
                codec.encode(RetrainingJob.manual(ModelIdentity.DISEASE_DETECTION, "second"))));
        DurableQueue failsOnThirdRead = new DurableQueue() {
            @Override
            public void push(String payload) {}

            @Override
            public Optional<String> pop() {
                if (payloads.isEmpty()) {
                    throw new RedisConnectionFailureException("connection reset");
                }
                return Optional.of(payloads.remove(0));
            }

            @Override
            public long size() {
                return 3;
            }

            @Override
            public void deadLetter(String payload, String reason) {}
        };

        List<RetrainingJob> jobs = new RetrainingQueue(failsOnThirdRead, codec).dequeueAll();

        assertThat(jobs)
                .extracting(RetrainingJob::getModelIdentity)
                .containsExactly(ModelIdentity.PRICE_PREDICTION, ModelIdentity.DISEASE_DETECTION);
    }
}
