package com.modelmonitor.store;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.FeatureWindow;
import com.modelmonitor.domain.model.ObservationBatch;

/** Source of logged predictions and model input features. */
public interface ObservationStore {

    /** Predictions with their outcomes from the last {@code windowDays}, oldest first. */
    ObservationBatch fetchPredictions(ModelIdentity modelIdentity, int windowDays);

    /** Per-feature input samples from the last {@code windowDays}. */
    FeatureWindow fetchFeatureWindow(ModelIdentity modelIdentity, int windowDays);
}
