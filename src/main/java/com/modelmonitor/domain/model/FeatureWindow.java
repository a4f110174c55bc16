package com.modelmonitor.domain.model;

import com.modelmonitor.domain.enums.ModelIdentity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/** Per-feature input samples observed for one model over a window. */
@Getter
public final class FeatureWindow {

    private final ModelIdentity modelIdentity;
    private final int windowDays;
    private final Map<String, List<Double>> samples;

    public FeatureWindow(ModelIdentity modelIdentity, int windowDays, Map<String, List<Double>> samples) {
        this.modelIdentity = modelIdentity;
        this.windowDays = windowDays;
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        samples.forEach((feature, values) -> {
            if (values != null && !values.isEmpty()) {
                copy.put(feature, List.copyOf(values));
            }
        });
        this.samples = Collections.unmodifiableMap(copy);
    }

    public Set<String> featureNames() {
        return samples.keySet();
    }

    public double[] valuesOf(String feature) {
        List<Double> values = samples.getOrDefault(feature, List.of());
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }
}
