package com.modelmonitor.evaluation;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.Issue;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.ModelThresholds;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a metric set and the model's thresholds to the list of violated limits.
 *
 * <p>Every check runs, so one call reports all simultaneous violations. A null limit
 * disables its check. A configured limit whose metric is absent from the set passes;
 * {@link #unmeasured} names those limits so the result can tell "healthy" from "not measured".
 */
@Component
public class ThresholdPolicy {

    private static final Logger log = LoggerFactory.getLogger(ThresholdPolicy.class);

    public List<Issue> evaluate(ModelIdentity modelIdentity, MetricSet metrics, ModelThresholds thresholds) {
        List<Issue> issues = new ArrayList<>();

        for (Check check : checksFor(modelIdentity, thresholds)) {
            OptionalDouble value = metrics.get(check.metric());
            if (value.isEmpty()) {
                continue;
            }
            double observed = value.getAsDouble();
            boolean violated = check.upperBound() ? observed > check.limit() : observed < check.limit();
            if (violated) {
                issues.add(Issue.metric(
                        check.metric(),
                        String.format(Locale.ROOT, check.template(), observed)
                                + String.format(Locale.ROOT, " (limit %.2f)", check.limit()),
                        observed,
                        check.limit()));
            }
        }

        if (!issues.isEmpty()) {
            log.info("Threshold violations: model={}, issues={}", modelIdentity.getKey(), issues);
        }
        return issues;
    }

    /** Metrics that have a configured limit but are missing from the set. */
    public List<String> unmeasured(ModelIdentity modelIdentity, MetricSet metrics, ModelThresholds thresholds) {
        List<String> unmeasured = checksFor(modelIdentity, thresholds).stream()
                .map(Check::metric)
                .filter(metric -> !metrics.has(metric))
                .toList();

        if (!unmeasured.isEmpty()) {
            log.warn(
                    "Metrics unmeasured, treated as passing: model={}, metrics={}",
                    modelIdentity.getKey(),
                    unmeasured);
        }
        return unmeasured;
    }

    private List<Check> checksFor(ModelIdentity modelIdentity, ModelThresholds thresholds) {
        List<Check> checks = new ArrayList<>();
        switch (modelIdentity.getFamily()) {
            case REGRESSION -> {
                addMax(checks, MetricSet.MAPE, thresholds.getMaxMapePercent(), "MAPE too high: %.2f%%");
                addMin(
                        checks,
                        MetricSet.DIRECTIONAL_ACCURACY,
                        thresholds.getMinDirectionalAccuracyPercent(),
                        "Directional accuracy too low: %.2f%%");
                addMax(checks, MetricSet.RMSE, thresholds.getMaxRmse(), "RMSE too high: %.2f");
            }
            case CLASSIFICATION -> {
                addMin(checks, MetricSet.ACCURACY, thresholds.getMinAccuracy(), "Accuracy too low: %.2f");
                addMin(checks, MetricSet.F1_SCORE, thresholds.getMinF1Score(), "F1 score too low: %.2f");
                addMin(checks, MetricSet.RECALL, thresholds.getMinRecall(), "Recall too low: %.2f");
            }
            case RANKING -> {
                addMin(checks, MetricSet.PRECISION_AT_5, thresholds.getMinPrecisionAt5(), "Precision@5 too low: %.2f");
                addMin(checks, MetricSet.CTR, thresholds.getMinCtr(), "CTR too low: %.2f");
                addMin(
                        checks,
                        MetricSet.PRECISION_AT_10,
                        thresholds.getMinPrecisionAt10(),
                        "Precision@10 too low: %.2f");
            }
        }
        return checks;
    }

    private void addMax(List<Check> checks, String metric, Double limit, String template) {
        if (limit != null) {
            checks.add(new Check(metric, limit, true, template));
        }
    }

    private void addMin(List<Check> checks, String metric, Double limit, String template) {
        if (limit != null) {
            checks.add(new Check(metric, limit, false, template));
        }
    }

    private record Check(String metric, double limit, boolean upperBound, String template) {}
}
