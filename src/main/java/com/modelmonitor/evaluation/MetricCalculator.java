package com.modelmonitor.evaluation;

import com.modelmonitor.domain.enums.ModelFamily;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.ObservationBatch;

/**
 * Computes the performance metrics of one model family from a batch of observations.
 * Implementations are pure and stateless; the batch size has already been checked.
 */
public interface MetricCalculator {

    /** Guard added to denominators that can be zero. */
    double EPSILON = 1e-7;

    ModelFamily family();

    MetricSet calculate(ObservationBatch batch);
}
