package com.modelmonitor.observability;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.Issue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the Micrometer meters of the monitoring loop.
 * <ul>
 *   <li><b>monitoring.cycles</b> (counter): completed cycles</li>
 *   <li><b>monitoring.model.errors</b> (counter, tag model): evaluations that ended in ERROR</li>
 *   <li><b>monitoring.issues</b> (counter, tags model, type): issues raised</li>
 *   <li><b>retraining.jobs</b> (counter, tag outcome): succeeded, requeued, abandoned, restored, dead_lettered</li>
 *   <li><b>monitoring.cycle.duration</b> (timer): wall time of a full cycle</li>
 *   <li><b>retraining.queue.depth</b> (gauge): queue size last observed by the loop</li>
 * </ul>
 *
 * <p>The queue gauge reads a cached value so a scrape never touches Redis.
 */
@Service
public class MonitoringMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter cycleCounter;
    private final Timer cycleTimer;
    private final AtomicLong queueDepth = new AtomicLong();

    public MonitoringMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.cycleCounter = Counter.builder("monitoring.cycles")
                .description("Completed monitoring cycles")
                .register(meterRegistry);

        this.cycleTimer = Timer.builder("monitoring.cycle.duration")
                .description("Wall time of one evaluate, persist and drain cycle")
                .register(meterRegistry);

        meterRegistry.gauge("retraining.queue.depth", queueDepth);
    }

    public void recordCycle(Duration duration) {
        cycleCounter.increment();
        cycleTimer.record(duration);
    }

    public void recordModelError(ModelIdentity modelIdentity) {
        meterRegistry.counter("monitoring.model.errors", "model", modelIdentity.getKey()).increment();
    }

    public void recordIssue(ModelIdentity modelIdentity, Issue issue) {
        meterRegistry
                .counter("monitoring.issues", "model", modelIdentity.getKey(), "type", issue.getType().name())
                .increment();
    }

    public void recordJobOutcome(String outcome) {
        meterRegistry.counter("retraining.jobs", "outcome", outcome).increment();
    }

    public void updateQueueDepth(long depth) {
        queueDepth.set(depth);
    }
}
