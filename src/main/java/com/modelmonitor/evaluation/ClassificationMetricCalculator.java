package com.modelmonitor.evaluation;

import com.modelmonitor.domain.enums.ModelFamily;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.Observation;
import com.modelmonitor.domain.model.ObservationBatch;
import org.springframework.stereotype.Component;

/**
 * Disease detection metrics from a 2x2 confusion count: accuracy, precision, recall and F1.
 *
 * <p>Denominators carry {@link #EPSILON}, so a class that never occurs gives a metric near
 * zero rather than a division error.
 */
@Component
public class ClassificationMetricCalculator implements MetricCalculator {

    private static final double POSITIVE_CUTOFF = 0.5;

    @Override
    public ModelFamily family() {
        return ModelFamily.CLASSIFICATION;
    }

    @Override
    public MetricSet calculate(ObservationBatch batch) {
        long truePositives = 0;
        long trueNegatives = 0;
        long falsePositives = 0;
        long falseNegatives = 0;

        for (Observation observation : batch.getObservations()) {
            if (!observation.hasActual()) {
                continue;
            }
            boolean actual = observation.getActual() >= POSITIVE_CUTOFF;
            boolean predicted = observation.getPredicted() >= POSITIVE_CUTOFF;
            if (actual && predicted) {
                truePositives++;
            } else if (!actual && !predicted) {
                trueNegatives++;
            } else if (predicted) {
                falsePositives++;
            } else {
                falseNegatives++;
            }
        }

        MetricSet.Builder metrics = MetricSet.builder(batch.size());
        long labelled = truePositives + trueNegatives + falsePositives + falseNegatives;
        if (labelled == 0) {
            return metrics.build();
        }

        double precision = truePositives / (truePositives + falsePositives + EPSILON);
        double recall = truePositives / (truePositives + falseNegatives + EPSILON);
        double f1 = 2 * precision * recall / (precision + recall + EPSILON);

        return metrics.put(MetricSet.ACCURACY, (double) (truePositives + trueNegatives) / labelled)
                .put(MetricSet.PRECISION, precision)
                .put(MetricSet.RECALL, recall)
                .put(MetricSet.F1_SCORE, f1)
                .build();
    }
}
