package com.modelmonitor.drift;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.FeatureBaseline;
import com.modelmonitor.domain.model.FeatureDistribution;
import com.modelmonitor.domain.model.FeatureWindow;
import com.modelmonitor.domain.model.Issue;
import com.modelmonitor.domain.model.ModelThresholds;
import com.modelmonitor.exception.PersistenceException;
import com.modelmonitor.store.ObservationStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compares a model's recent input features against its frozen baseline.
 *
 * <p>On the first check for a model there is no baseline: the capture window is frozen with
 * a single create-if-absent write and no drift is reported. Later checks only read the
 * baseline. Features missing on either side are skipped.
 */
@Service
public class DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftDetector.class);

    private final ObservationStore observationStore;
    private final BaselineStore baselineStore;
    private final BaselineFactory baselineFactory;
    private final PsiCalculator psiCalculator;
    private final MonitoringProperties monitoringProperties;

    public DriftDetector(
            ObservationStore observationStore,
            BaselineStore baselineStore,
            BaselineFactory baselineFactory,
            PsiCalculator psiCalculator,
            MonitoringProperties monitoringProperties) {
        this.observationStore = observationStore;
        this.baselineStore = baselineStore;
        this.baselineFactory = baselineFactory;
        this.psiCalculator = psiCalculator;
        this.monitoringProperties = monitoringProperties;
    }

    /**
     * @throws com.modelmonitor.exception.EvaluationException if feature samples cannot be read
     */
    public List<Issue> checkDrift(ModelIdentity modelIdentity, ModelThresholds thresholds) {
        Optional<FeatureBaseline> existing = baselineStore.find(modelIdentity);
        if (existing.isEmpty()) {
            captureBaseline(modelIdentity);
            return List.of();
        }

        FeatureBaseline baseline = existing.get();
        FeatureWindow current =
                observationStore.fetchFeatureWindow(modelIdentity, monitoringProperties.getLookbackDays());
        int bins = monitoringProperties.getDrift().getBins();

        List<Issue> issues = new ArrayList<>();
        for (String feature : current.featureNames()) {
            FeatureDistribution reference = baseline.getFeatures().get(feature);
            if (reference == null || reference.getReferenceValues().isEmpty()) {
                continue;
            }
            double psi = psiCalculator.calculate(reference.referenceArray(), current.valuesOf(feature), bins);
            log.debug("PSI computed: model={}, feature={}, psi={}", modelIdentity.getKey(), feature, psi);
            if (psi > thresholds.getMaxDriftPsi()) {
                issues.add(Issue.drift(feature, psi, thresholds.getMaxDriftPsi()));
            }
        }

        if (!issues.isEmpty()) {
            log.info("Feature drift detected: model={}, issues={}", modelIdentity.getKey(), issues);
        }
        return issues;
    }

    private void captureBaseline(ModelIdentity modelIdentity) {
        FeatureWindow window =
                observationStore.fetchFeatureWindow(modelIdentity, monitoringProperties.getBaselineWindowDays());
        if (window.isEmpty()) {
            log.info("No feature samples yet for {}, baseline capture deferred", modelIdentity.getKey());
            return;
        }

        try {
            boolean created = baselineStore.createIfAbsent(baselineFactory.fromWindow(window));
            if (created) {
                log.info("Baseline captured: model={}, features={}", modelIdentity.getKey(), window.featureNames());
            } else {
                log.info("Baseline for {} was captured concurrently, keeping it", modelIdentity.getKey());
            }
        } catch (PersistenceException e) {
            log.warn("Baseline capture failed for {}, drift check skipped: {}", modelIdentity.getKey(),
                    e.getMessage());
        }
    }
}
