package com.modelmonitor.evaluation;

import com.modelmonitor.domain.enums.ModelFamily;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.ModelThresholds;
import com.modelmonitor.domain.model.ObservationBatch;
import com.modelmonitor.exception.InsufficientDataException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes the metric set for a model by dispatching to the calculator of its family.
 *
 * <p>The sample-size check runs first: a batch below {@code minSamples} raises
 * {@link InsufficientDataException} and no metric is computed.
 */
@Component
public class MetricEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MetricEvaluator.class);

    private final Map<ModelFamily, MetricCalculator> calculators = new EnumMap<>(ModelFamily.class);

    public MetricEvaluator(List<MetricCalculator> metricCalculators) {
        for (MetricCalculator calculator : metricCalculators) {
            calculators.put(calculator.family(), calculator);
        }
    }

    public MetricSet evaluate(ModelIdentity modelIdentity, ObservationBatch batch, ModelThresholds thresholds) {
        if (batch.size() < thresholds.getMinSamples()) {
            throw new InsufficientDataException(modelIdentity, batch.size(), thresholds.getMinSamples());
        }

        MetricCalculator calculator = calculators.get(modelIdentity.getFamily());
        if (calculator == null) {
            throw new IllegalStateException("No metric calculator for family " + modelIdentity.getFamily());
        }

        MetricSet metrics = calculator.calculate(batch);
        log.debug("Metrics computed: model={}, metrics={}", modelIdentity.getKey(), metrics.asMap());
        return metrics;
    }
}
