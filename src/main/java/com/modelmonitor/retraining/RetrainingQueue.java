package com.modelmonitor.retraining;

import com.modelmonitor.domain.model.RetrainingJob;
import com.modelmonitor.exception.MalformedJobPayloadException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * FIFO queue of pending retraining jobs over a {@link DurableQueue}.
 *
 * <p>All operations hold one lock, so a drain never interleaves with an enqueue from this
 * process. {@link #dequeueAll()} removes at most the number of payloads present when it
 * starts; jobs pushed during the drain wait for the next one. Payloads that fail to decode
 * are dead-lettered and skipped. A read failure part way through returns the jobs already
 * removed so none of them is dropped.
 */
@Component
public class RetrainingQueue {

    private static final Logger log = LoggerFactory.getLogger(RetrainingQueue.class);

    private final DurableQueue durableQueue;
    private final RetrainingJobCodec retrainingJobCodec;
    private final ReentrantLock lock = new ReentrantLock();

    public RetrainingQueue(DurableQueue durableQueue, RetrainingJobCodec retrainingJobCodec) {
        this.durableQueue = durableQueue;
        this.retrainingJobCodec = retrainingJobCodec;
    }

    public void enqueue(RetrainingJob job) {
        lock.lock();
        try {
            durableQueue.push(retrainingJobCodec.encode(job));
            log.info(
                    "Retraining job queued: id={}, model={}, trigger={}, attempt={}",
                    job.getId(),
                    job.getModelIdentity().getKey(),
                    job.getTrigger(),
                    job.getAttemptCount());
        } finally {
            lock.unlock();
        }
    }

    public List<RetrainingJob> dequeueAll() {
        lock.lock();
        try {
            long snapshot = durableQueue.size();
            List<RetrainingJob> jobs = new ArrayList<>();
            for (long i = 0; i < snapshot; i++) {
                Optional<String> payload;
                try {
                    payload = durableQueue.pop();
                } catch (RuntimeException e) {
                    if (jobs.isEmpty()) {
                        throw e;
                    }
                    log.error("Queue read failed after {} of {} jobs, keeping those: {}", jobs.size(), snapshot,
                            e.getMessage());
                    break;
                }
                if (payload.isEmpty()) {
                    break;
                }
                try {
                    jobs.add(retrainingJobCodec.decode(payload.get()));
                } catch (MalformedJobPayloadException e) {
                    log.warn("Malformed retraining payload moved to dead letter: {}", e.describe());
                    durableQueue.deadLetter(payload.get(), e.describe());
                }
            }
            if (!jobs.isEmpty()) {
                log.info("Dequeued {} retraining jobs", jobs.size());
            }
            return jobs;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues a job that was already dequeued, without throwing.
     *
     * <p>If the push fails the job is dead-lettered instead. If that fails as well, its payload
     * is logged at ERROR so it can be replayed by hand.
     *
     * @return true if the job is back in the queue
     */
    public boolean putBack(RetrainingJob job) {
        try {
            enqueue(job);
            return true;
        } catch (RuntimeException e) {
            String payload = retrainingJobCodec.encode(job);
            log.error("Failed to put retraining job {} back on the queue: {}", job.getId(), e.getMessage());
            try {
                durableQueue.deadLetter(payload, "Queue push failed: " + e.getMessage());
                log.warn("Retraining job {} moved to dead letter", job.getId());
            } catch (RuntimeException deadLetterFailure) {
                log.error(
                        "Retraining job lost, dead letter failed too ({}): payload={}",
                        deadLetterFailure.getMessage(),
                        payload);
            }
            return false;
        }
    }

    public long size() {
        lock.lock();
        try {
            return durableQueue.size();
        } finally {
            lock.unlock();
        }
    }
}
