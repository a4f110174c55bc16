package com.modelmonitor.domain.enums;

public enum IssueType {

    /** A performance metric crossed its configured limit. */
    METRIC_THRESHOLD,

    /** A feature's PSI against the frozen baseline exceeded the drift limit. */
    FEATURE_DRIFT
}
