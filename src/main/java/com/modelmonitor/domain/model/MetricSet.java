package com.modelmonitor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Metrics computed for one model in one evaluation. Always carries {@link #SAMPLE_COUNT}.
 * A metric that could not be computed is absent, never NaN.
 */
@EqualsAndHashCode
@ToString
public final class MetricSet {

    public static final String SAMPLE_COUNT = "sample_count";

    public static final String MAPE = "mape";
    public static final String RMSE = "rmse";
    public static final String DIRECTIONAL_ACCURACY = "directional_accuracy";

    public static final String ACCURACY = "accuracy";
    public static final String PRECISION = "precision";
    public static final String RECALL = "recall";
    public static final String F1_SCORE = "f1_score";

    public static final String CTR = "ctr";
    public static final String PRECISION_AT_5 = "precision_at_5";
    public static final String PRECISION_AT_10 = "precision_at_10";

    private final Map<String, Double> values;

    private MetricSet(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder(int sampleCount) {
        return new Builder(sampleCount);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static MetricSet fromMap(Map<String, Double> values) {
        if (!values.containsKey(SAMPLE_COUNT)) {
            throw new IllegalArgumentException("Metric set without " + SAMPLE_COUNT);
        }
        return new MetricSet(values);
    }

    public OptionalDouble get(String name) {
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public int getSampleCount() {
        return values.get(SAMPLE_COUNT).intValue();
    }

    @JsonValue
    public Map<String, Double> asMap() {
        return values;
    }

    public static final class Builder {

        private final Map<String, Double> values = new LinkedHashMap<>();

        private Builder(int sampleCount) {
            values.put(SAMPLE_COUNT, (double) sampleCount);
        }

        /** Adds a metric; NaN and infinite values are dropped so the metric reads as absent. */
        public Builder put(String name, double value) {
            if (Double.isFinite(value)) {
                values.put(name, value);
            }
            return this;
        }

        public MetricSet build() {
            return new MetricSet(values);
        }
    }
}
