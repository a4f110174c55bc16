package com.modelmonitor.retraining;

import lombok.Builder;
import lombok.Value;

/** Outcome counts of one queue drain. */
@Value
@Builder
public class DrainSummary {

    int dequeued;
    int succeeded;
    int requeued;
    int abandoned;

    /** Jobs put back unprocessed because a stop was requested. */
    int restored;

    /** Jobs that could not be pushed back and went to the dead-letter store instead. */
    int deadLettered;

    public static DrainSummary empty() {
        return DrainSummary.builder().build();
    }
}
