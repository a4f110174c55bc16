package com.modelmonitor.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Frozen summary of one feature's values: a bounded, sorted reference sample for PSI
 * binning plus descriptive statistics over the full capture window.
 */
@Value
@Builder
@Jacksonized
public class FeatureDistribution {

    List<Double> referenceValues;
    long count;
    double mean;
    double stdDev;
    double min;
    double max;

    public double[] referenceArray() {
        return referenceValues.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
