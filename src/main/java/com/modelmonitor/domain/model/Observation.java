package com.modelmonitor.domain.model;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One logged prediction together with its realized outcome.
 *
 * <p>Field meaning depends on the model family: for regression both values are prices,
 * for classification they are 0/1 labels, for ranking {@code actual} is the clicked
 * indicator and {@code userId}/{@code rank} place the item in a user's list.
 * {@code actual} is null when the outcome has not been recorded yet.
 */
@Value
@Builder
public class Observation {

    double predicted;

    Double actual;

    @Builder.Default
    Map<String, Double> features = Map.of();

    LocalDateTime timestamp;

    String userId;

    /** 1-based position in the user's recommendation list. Null outside the ranking family. */
    Integer rank;

    public boolean hasActual() {
        return actual != null && !actual.isNaN();
    }
}
