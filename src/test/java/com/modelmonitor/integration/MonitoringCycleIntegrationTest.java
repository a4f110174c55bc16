package com.modelmonitor.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;

import com.modelmonitor.config.MonitoringProperties;
import com.modelmonitor.config.NotificationProperties;
import com.modelmonitor.config.ThresholdsProvider;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.enums.MonitoringStatus;
import com.modelmonitor.domain.model.Issue;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.MonitoringResult;
import com.modelmonitor.domain.model.RetrainingJob;
import com.modelmonitor.domain.enums.NotificationChannel;
import com.modelmonitor.drift.BaselineFactory;
import com.modelmonitor.drift.BaselineService;
import com.modelmonitor.drift.DriftDetector;
import com.modelmonitor.drift.PsiCalculator;
import com.modelmonitor.evaluation.ClassificationMetricCalculator;
import com.modelmonitor.evaluation.MetricEvaluator;
import com.modelmonitor.evaluation.ModelEvaluationService;
import com.modelmonitor.evaluation.RankingMetricCalculator;
import com.modelmonitor.evaluation.RegressionMetricCalculator;
import com.modelmonitor.evaluation.ThresholdPolicy;
import com.modelmonitor.notification.AlertNotifier;
import com.modelmonitor.notification.AlertSeverityRouter;
import com.modelmonitor.notification.NotificationTemplateEngine;
import com.modelmonitor.observability.MonitoringMetrics;
import com.modelmonitor.repository.redis.ModelStatusRedisRepository;
import com.modelmonitor.retraining.RetrainingJobCodec;
import com.modelmonitor.retraining.RetrainingProcessor;
import com.modelmonitor.retraining.RetrainingQueue;
import com.modelmonitor.retraining.RetrainingService;
import com.modelmonitor.scheduler.CycleReport;
import com.modelmonitor.scheduler.MonitoringScheduler;
import com.modelmonitor.service.ModelStatusService;
import com.modelmonitor.support.FakeTrainer;
import com.modelmonitor.support.InMemoryBaselineStore;
import com.modelmonitor.support.InMemoryDurableQueue;
import com.modelmonitor.support.InMemoryMonitoringRecordStore;
import com.modelmonitor.support.InMemoryObservationStore;
import com.modelmonitor.support.ObservationFixtures;
import com.modelmonitor.support.RecordingNotificationSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * End-to-end test of the monitoring cycle.
 * Wires real evaluation, drift, retraining, notification and scheduler components over
 * in-memory stores to verify: evaluate -> alert -> enqueue -> persist -> drain -> retry/abandon.
 */
class MonitoringCycleIntegrationTest {

    private static final double[] ACTUALS = {100, 102, 104};
    private static final double[] PREDICTED = {100, 101, 108};

    private MonitoringProperties monitoringProperties;
    private InMemoryObservationStore observationStore;
    private InMemoryMonitoringRecordStore recordStore;
    private InMemoryDurableQueue durableQueue;
    private RecordingNotificationSink email;
    private RecordingNotificationSink telegram;
    private ThreadPoolTaskExecutor evaluationExecutor;
    private ThreadPoolTaskExecutor trainingExecutor;
    private RetrainingQueue retrainingQueue;
    private FakeTrainer trainer;

    @BeforeEach
    void setUp() {
        monitoringProperties = new MonitoringProperties();
        monitoringProperties.getThresholds().put(ModelIdentity.PRICE_PREDICTION, ObservationFixtures.priceThresholds());
        monitoringProperties.getThresholds().put(ModelIdentity.DISEASE_DETECTION, ObservationFixtures.diseaseThresholds());
        monitoringProperties
                .getThresholds()
                .put(ModelIdentity.RECOMMENDATION, ObservationFixtures.recommendationThresholds());

        observationStore = new InMemoryObservationStore();
        recordStore = new InMemoryMonitoringRecordStore();
        durableQueue = new InMemoryDurableQueue();
        email = new RecordingNotificationSink(NotificationChannel.EMAIL);
        telegram = new RecordingNotificationSink(NotificationChannel.TELEGRAM);
        retrainingQueue = new RetrainingQueue(durableQueue, new RetrainingJobCodec());
        trainer = FakeTrainer.succeeding();

        evaluationExecutor = executor("it-evaluation-", 3);
        trainingExecutor = executor("it-training-", 1);
    }

    @AfterEach
    void tearDown() {
        evaluationExecutor.shutdown();
        trainingExecutor.shutdown();
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }

    private MonitoringScheduler scheduler() {
        InMemoryBaselineStore baselineStore = new InMemoryBaselineStore();
        BaselineFactory baselineFactory = new BaselineFactory(monitoringProperties);
        NotificationProperties notificationProperties = new NotificationProperties();
        AlertNotifier alertNotifier = new AlertNotifier(
                new AlertSeverityRouter(notificationProperties),
                new NotificationTemplateEngine(notificationProperties),
                List.of(email, telegram));
        ModelStatusService modelStatusService = new ModelStatusService(mock(ModelStatusRedisRepository.class));
        MonitoringMetrics monitoringMetrics = new MonitoringMetrics(new SimpleMeterRegistry());

        ModelEvaluationService evaluationService = new ModelEvaluationService(
                observationStore,
                new MetricEvaluator(List.of(
                        new RegressionMetricCalculator(),
                        new ClassificationMetricCalculator(),
                        new RankingMetricCalculator())),
                new ThresholdPolicy(),
                new DriftDetector(observationStore, baselineStore, baselineFactory, new PsiCalculator(),
                        monitoringProperties),
                monitoringProperties);
        RetrainingProcessor retrainingProcessor = new RetrainingProcessor(
                retrainingQueue,
                trainer,
                trainingExecutor,
                alertNotifier,
                modelStatusService,
                new BaselineService(observationStore, baselineStore, baselineFactory, monitoringProperties),
                monitoringMetrics,
                monitoringProperties);

        return new MonitoringScheduler(
                evaluationService,
                new ThresholdsProvider(
                        monitoringProperties, Validation.buildDefaultValidatorFactory().getValidator()),
                recordStore,
                new RetrainingService(retrainingQueue, alertNotifier),
                retrainingProcessor,
                modelStatusService,
                monitoringMetrics,
                monitoringProperties,
                evaluationExecutor);
    }

    @Test
    @DisplayName("Price model above MAPE limit raises one issue, queues a job and retrains it in the same cycle")
    void degradedPriceModel_retrainedWithinCycle() {
        monitoringProperties.getThresholds().get(ModelIdentity.PRICE_PREDICTION).setMaxMapePercent(1.0);
        observationStore.withPredictions(
                ModelIdentity.PRICE_PREDICTION, ObservationFixtures.repeated(ACTUALS, PREDICTED, 400));

        CycleReport report = scheduler().runCycle();

        MonitoringResult price = report.getMonitoringRecord().getResults().get(ModelIdentity.PRICE_PREDICTION);
        assertThat(price.getStatus()).isEqualTo(MonitoringStatus.COMPLETED);
        assertThat(price.getSampleCount()).isEqualTo(1200);
        assertThat(price.getMetrics().get(MetricSet.MAPE).getAsDouble()).isCloseTo(1.609, within(0.01));
        assertThat(price.getMetrics().get(MetricSet.DIRECTIONAL_ACCURACY).getAsDouble()).isEqualTo(100.0);
        assertThat(price.getIssues()).extracting(Issue::getSubject).containsExactly(MetricSet.MAPE);

        assertThat(report.isPersisted()).isTrue();
        assertThat(report.getRetrainingRequested()).isEqualTo(1);
        assertThat(report.getDrainSummary().getSucceeded()).isEqualTo(1);
        assertThat(trainer.getCalls()).containsExactly(ModelIdentity.PRICE_PREDICTION);
        assertThat(retrainingQueue.size()).isZero();
        assertThat(email.getSubjects())
                .contains("Model Retraining Required: price_prediction", "Model Retrained: price_prediction");
    }

    @Test
    @DisplayName("Disease model with no true positives reports an F1 issue")
    void diseaseModelWithoutTruePositives_f1Issue() {
        observationStore.withPredictions(
                ModelIdentity.DISEASE_DETECTION,
                ObservationFixtures.repeated(new double[] {1, 0}, new double[] {0.2, 0.1}, 300));

        CycleReport report = scheduler().runCycle();

        MonitoringResult disease = report.getMonitoringRecord().getResults().get(ModelIdentity.DISEASE_DETECTION);
        assertThat(disease.getMetrics().get(MetricSet.F1_SCORE).getAsDouble()).isCloseTo(0.0, within(1e-6));
        assertThat(disease.getIssues()).extracting(Issue::getSubject).contains(MetricSet.F1_SCORE);
        assertThat(disease.isNeedsRetraining()).isTrue();
    }

    @Test
    @DisplayName("Too few samples yields INSUFFICIENT_DATA and no retraining")
    void tooFewSamples_insufficientData() {
        observationStore.withPredictions(
                ModelIdentity.DISEASE_DETECTION,
                ObservationFixtures.repeated(new double[] {1, 0}, new double[] {0.9, 0.1}, 25));

        CycleReport report = scheduler().runCycle();

        MonitoringResult disease = report.getMonitoringRecord().getResults().get(ModelIdentity.DISEASE_DETECTION);
        assertThat(disease.getStatus()).isEqualTo(MonitoringStatus.INSUFFICIENT_DATA);
        assertThat(disease.getSampleCount()).isEqualTo(50);
        assertThat(report.getRetrainingRequested()).isZero();
        assertThat(durableQueue.getPayloads()).isEmpty();
    }

    @Test
    @DisplayName("Failing trainer is retried on later cycles and abandoned after three attempts")
    void failingTrainer_abandonedAfterThreeCycles() {
        trainer = FakeTrainer.failing("pipeline unavailable");
        monitoringProperties.getThresholds().get(ModelIdentity.PRICE_PREDICTION).setMaxMapePercent(1.0);
        observationStore.withPredictions(
                ModelIdentity.PRICE_PREDICTION, ObservationFixtures.repeated(ACTUALS, PREDICTED, 400));
        MonitoringScheduler scheduler = scheduler();

        CycleReport first = scheduler.runCycle();
        observationStore.withPredictions(
                ModelIdentity.PRICE_PREDICTION, ObservationFixtures.repeated(ACTUALS, ACTUALS, 400));
        CycleReport second = scheduler.runCycle();
        List<RetrainingJob> pending = List.copyOf(peek());
        CycleReport third = scheduler.runCycle();

        assertThat(first.getDrainSummary().getRequeued()).isEqualTo(1);
        assertThat(second.getRetrainingRequested()).isZero();
        assertThat(second.getDrainSummary().getRequeued()).isEqualTo(1);
        assertThat(pending).singleElement().extracting(RetrainingJob::getAttemptCount).isEqualTo(2);
        assertThat(third.getDrainSummary().getAbandoned()).isEqualTo(1);
        assertThat(trainer.getCalls()).hasSize(3);
        assertThat(retrainingQueue.size()).isZero();
        assertThat(telegram.getSubjects()).contains("Model Retraining Abandoned: price_prediction");
        assertThat(recordStore.getRecords()).hasSize(3);
    }

    private List<RetrainingJob> peek() {
        List<RetrainingJob> jobs = retrainingQueue.dequeueAll();
        jobs.forEach(retrainingQueue::putBack);
        return jobs;
    }
}
