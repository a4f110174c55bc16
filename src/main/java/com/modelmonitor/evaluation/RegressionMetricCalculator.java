package com.modelmonitor.evaluation;

import com.modelmonitor.domain.enums.ModelFamily;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.Observation;
import com.modelmonitor.domain.model.ObservationBatch;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Price prediction metrics: MAPE (percent), RMSE, and directional accuracy (percent of
 * consecutive moves whose direction was predicted correctly).
 *
 * <p>Observations without an actual price are skipped. Directional accuracy needs at least
 * two ordered observations and is left out of the set otherwise.
 */
@Component
public class RegressionMetricCalculator implements MetricCalculator {

    @Override
    public ModelFamily family() {
        return ModelFamily.REGRESSION;
    }

    @Override
    public MetricSet calculate(ObservationBatch batch) {
        List<Observation> observations =
                batch.getObservations().stream().filter(Observation::hasActual).toList();
        MetricSet.Builder metrics = MetricSet.builder(batch.size());
        if (observations.isEmpty()) {
            return metrics.build();
        }

        double absolutePercentSum = 0;
        double squaredErrorSum = 0;
        for (Observation observation : observations) {
            double actual = observation.getActual();
            double error = actual - observation.getPredicted();
            absolutePercentSum += Math.abs(error) / (Math.abs(actual) + EPSILON);
            squaredErrorSum += error * error;
        }

        int n = observations.size();
        metrics.put(MetricSet.MAPE, absolutePercentSum / n * 100);
        metrics.put(MetricSet.RMSE, Math.sqrt(squaredErrorSum / n));

        if (n >= 2) {
            int agreements = 0;
            for (int i = 1; i < n; i++) {
                boolean actualUp = observations.get(i).getActual() - observations.get(i - 1).getActual() > 0;
                boolean predictedUp = observations.get(i).getPredicted() - observations.get(i - 1).getPredicted() > 0;
                if (actualUp == predictedUp) {
                    agreements++;
                }
            }
            metrics.put(MetricSet.DIRECTIONAL_ACCURACY, (double) agreements / (n - 1) * 100);
        }

        return metrics.build();
    }
}
