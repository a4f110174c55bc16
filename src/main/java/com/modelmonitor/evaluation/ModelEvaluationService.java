package com.modelmonitor.evaluation;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.Issue;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.ModelThresholds;
import com.modelmonitor.domain.model.MonitoringResult;
import com.modelmonitor.domain.model.ObservationBatch;
import com.modelmonitor.drift.DriftDetector;
import com.modelmonitor.exception.BaseException;
import com.modelmonitor.exception.InsufficientDataException;
import com.modelmonitor.store.ObservationStore;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates one model end to end: fetch the lookback window, compute metrics, check
 * thresholds, then check feature drift.
 *
 * <p>Never throws. Too few observations yield an INSUFFICIENT_DATA result without a drift
 * check; any other failure yields an ERROR result for this model only.
 */
@Service
public class ModelEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(ModelEvaluationService.class);

    private final ObservationStore observationStore;
    private final MetricEvaluator metricEvaluator;
    private final ThresholdPolicy thresholdPolicy;
    private final DriftDetector driftDetector;
    private final MonitoringProperties monitoringProperties;

    public ModelEvaluationService(
            ObservationStore observationStore,
            MetricEvaluator metricEvaluator,
            ThresholdPolicy thresholdPolicy,
            DriftDetector driftDetector,
            MonitoringProperties monitoringProperties) {
        this.observationStore = observationStore;
        this.metricEvaluator = metricEvaluator;
        this.thresholdPolicy = thresholdPolicy;
        this.driftDetector = driftDetector;
        this.monitoringProperties = monitoringProperties;
    }

    public MonitoringResult evaluateModel(ModelIdentity modelIdentity, ModelThresholds thresholds) {
        if (thresholds == null) {
            log.warn("No thresholds for {}, skipping evaluation", modelIdentity.getKey());
            return MonitoringResult.error(modelIdentity, "No thresholds configured");
        }

        try {
            ObservationBatch batch =
                    observationStore.fetchPredictions(modelIdentity, monitoringProperties.getLookbackDays());
            MetricSet metrics = metricEvaluator.evaluate(modelIdentity, batch, thresholds);

            List<Issue> issues = new ArrayList<>(thresholdPolicy.evaluate(modelIdentity, metrics, thresholds));
            List<String> unmeasured = thresholdPolicy.unmeasured(modelIdentity, metrics, thresholds);
            issues.addAll(driftDetector.checkDrift(modelIdentity, thresholds));

            MonitoringResult result = MonitoringResult.completed(modelIdentity, metrics, issues, unmeasured);
            log.info(
                    "Model evaluated: model={}, samples={}, issues={}",
                    modelIdentity.getKey(),
                    result.getSampleCount(),
                    issues.size());
            return result;

        } catch (InsufficientDataException e) {
            log.info("{}, skipping", e.getMessage());
            return MonitoringResult.insufficientData(modelIdentity, e.getSampleCount());
        } catch (BaseException e) {
            log.warn("Failed to monitor {}: {}", modelIdentity.getKey(), e.describe(), e);
            return MonitoringResult.error(modelIdentity, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to monitor {}: {}", modelIdentity.getKey(), e.getMessage(), e);
            return MonitoringResult.error(modelIdentity, e.getMessage());
        }
    }
}
