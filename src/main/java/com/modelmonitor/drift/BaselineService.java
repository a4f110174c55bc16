package com.modelmonitor.drift;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.FeatureBaseline;
import com.modelmonitor.domain.model.FeatureWindow;
import com.modelmonitor.exception.EvaluationException;
import com.modelmonitor.store.ObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Operator-facing baseline management. The only path that overwrites an existing baseline. */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final ObservationStore observationStore;
    private final BaselineStore baselineStore;
    private final BaselineFactory baselineFactory;
    private final MonitoringProperties monitoringProperties;

    public BaselineService(
            ObservationStore observationStore,
            BaselineStore baselineStore,
            BaselineFactory baselineFactory,
            MonitoringProperties monitoringProperties) {
        this.observationStore = observationStore;
        this.baselineStore = baselineStore;
        this.baselineFactory = baselineFactory;
        this.monitoringProperties = monitoringProperties;
    }

    /**
     * Re-captures the model's baseline from the most recent capture window and replaces
     * the stored one.
     *
     * @throws EvaluationException if there are no feature samples to capture
     */
    public FeatureBaseline resetBaseline(ModelIdentity modelIdentity) {
        FeatureWindow window =
                observationStore.fetchFeatureWindow(modelIdentity, monitoringProperties.getBaselineWindowDays());
        if (window.isEmpty()) {
            throw new EvaluationException(modelIdentity, "No feature samples to capture a baseline from");
        }
        FeatureBaseline baseline = baselineFactory.fromWindow(window);
        baselineStore.replace(baseline);
        log.info("Baseline reset: model={}, features={}", modelIdentity.getKey(), window.featureNames());
        return baseline;
    }
}
