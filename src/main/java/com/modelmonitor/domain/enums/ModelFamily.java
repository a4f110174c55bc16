package com.modelmonitor.domain.enums;

/**
 * Kind of prediction a monitored model makes. Selects the metric calculator,
 * the threshold checks and which {@link com.modelmonitor.domain.model.Observation}
 * fields carry meaning.
 */
public enum ModelFamily {

    /** Continuous target (price). Predicted and actual are real values. */
    REGRESSION,

    /** Binary label (disease present / absent). Values >= 0.5 are the positive class. */
    CLASSIFICATION,

    /** Ranked recommendations. Actual is the clicked indicator, grouped per user. */
    RANKING
}
