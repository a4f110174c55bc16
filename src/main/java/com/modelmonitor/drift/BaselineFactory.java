package com.modelmonitor.drift;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.domain.model.FeatureBaseline;
import com.modelmonitor.domain.model.FeatureDistribution;
import com.modelmonitor.domain.model.FeatureWindow;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Freezes a feature window into a {@link FeatureBaseline}.
 *
 * <p>Each feature keeps at most {@code drift.reference-sample-size} values, taken at an even
 * stride over the sorted sample so the stored quantiles match the full window.
 */
@Component
public class BaselineFactory {

    private final MonitoringProperties monitoringProperties;

    public BaselineFactory(MonitoringProperties monitoringProperties) {
        this.monitoringProperties = monitoringProperties;
    }

    public FeatureBaseline fromWindow(FeatureWindow window) {
        int limit = monitoringProperties.getDrift().getReferenceSampleSize();
        Map<String, FeatureDistribution> features = new LinkedHashMap<>();
        for (String feature : window.featureNames()) {
            features.put(feature, distribution(window.valuesOf(feature), limit));
        }
        return FeatureBaseline.builder()
                .modelIdentity(window.getModelIdentity())
                .capturedAt(LocalDateTime.now())
                .windowDays(window.getWindowDays())
                .features(features)
                .build();
    }

    FeatureDistribution distribution(double[] values, int limit) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double mean = Arrays.stream(sorted).average().orElse(0.0);
        double variance = Arrays.stream(sorted).map(v -> (v - mean) * (v - mean)).sum() / sorted.length;

        return FeatureDistribution.builder()
                .referenceValues(stride(sorted, limit))
                .count(sorted.length)
                .mean(mean)
                .stdDev(Math.sqrt(variance))
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .build();
    }

    private List<Double> stride(double[] sorted, int limit) {
        List<Double> reference = new ArrayList<>(Math.min(sorted.length, limit));
        if (sorted.length <= limit) {
            for (double value : sorted) {
                reference.add(value);
            }
            return reference;
        }
        double step = (double) (sorted.length - 1) / (limit - 1);
        for (int i = 0; i < limit; i++) {
            reference.add(sorted[(int) Math.round(i * step)]);
        }
        return reference;
    }
}
