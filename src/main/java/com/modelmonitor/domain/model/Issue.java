package com.modelmonitor.domain.model;

import com.modelmonitor.domain.enums.IssueType;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One violated condition found while monitoring a model. {@code subject} is the metric
 * name for threshold issues and the feature name for drift issues.
 */
@Value
@Builder
@Jacksonized
public class Issue {

    IssueType type;
    String subject;
    String message;
    Double observed;
    Double limit;

    public static Issue metric(String metric, String message, double observed, double limit) {
        return Issue.builder()
                .type(IssueType.METRIC_THRESHOLD)
                .subject(metric)
                .message(message)
                .observed(observed)
                .limit(limit)
                .build();
    }

    public static Issue drift(String feature, double psi, double limit) {
        return Issue.builder()
                .type(IssueType.FEATURE_DRIFT)
                .subject(feature)
                .message(String.format(Locale.ROOT, "Feature drift in %s: PSI = %.3f", feature, psi))
                .observed(psi)
                .limit(limit)
                .build();
    }

    @Override
    public String toString() {
        return message;
    }
}
