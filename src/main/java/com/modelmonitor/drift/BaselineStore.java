package com.modelmonitor.drift;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.FeatureBaseline;
import java.util.Optional;

/** Persistent home of each model's frozen feature baseline. */
public interface BaselineStore {

    Optional<FeatureBaseline> find(ModelIdentity modelIdentity);

    /**
     * Writes the baseline only if the model has none. Atomic with respect to concurrent writers.
     *
     * @return true if this call created the baseline
     * @throws com.modelmonitor.exception.PersistenceException if the write fails
     */
    boolean createIfAbsent(FeatureBaseline baseline);

    /** Unconditionally replaces the model's baseline. Operator action only. */
    void replace(FeatureBaseline baseline);
}
