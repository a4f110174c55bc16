package com.modelmonitor.domain.model;

import com.modelmonitor.domain.enums.ModelIdentity;
import java.util.Comparator;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Observations for one model over a lookback window, ordered oldest first.
 * Immutable; owned by the evaluation that fetched it.
 */
@Getter
@ToString(exclude = "observations")
public final class ObservationBatch {

    private final ModelIdentity modelIdentity;
    private final int windowDays;
    private final List<Observation> observations;

    private ObservationBatch(ModelIdentity modelIdentity, int windowDays, List<Observation> observations) {
        this.modelIdentity = modelIdentity;
        this.windowDays = windowDays;
        this.observations = observations;
    }

    /** Creates a batch, sorting by timestamp (observations without one keep their relative order at the end). */
    public static ObservationBatch of(ModelIdentity modelIdentity, int windowDays, List<Observation> observations) {
        List<Observation> ordered = observations.stream()
                .sorted(Comparator.comparing(
                        Observation::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        return new ObservationBatch(modelIdentity, windowDays, ordered);
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }
}
