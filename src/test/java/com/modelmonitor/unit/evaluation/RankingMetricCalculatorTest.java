package com.modelmonitor.unit.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.Observation;
import com.modelmonitor.evaluation.RankingMetricCalculator;
import com.modelmonitor.support.ObservationFixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RankingMetricCalculator.
 *
 * <p>Two users: A has six ranked items with clicks at ranks 1 and 2, B has three items with
 * a click at rank 1.
 */
class RankingMetricCalculatorTest {

    private final RankingMetricCalculator calculator = new RankingMetricCalculator();

    private MetricSet metrics;

    @BeforeEach
    void setUp() {
        List<Observation> observations = new ArrayList<>();
        for (int rank = 6; rank >= 1; rank--) {
            observations.add(ObservationFixtures.ranked("A", rank, rank <= 2));
        }
        for (int rank = 1; rank <= 3; rank++) {
            observations.add(ObservationFixtures.ranked("B", rank, rank == 1));
        }
        metrics = calculator.calculate(ObservationFixtures.batch(ModelIdentity.RECOMMENDATION, observations));
    }

    @Test
    void ctr_clicksOverAllRows() {
        assertThat(metrics.get(MetricSet.CTR).getAsDouble()).isCloseTo(3.0 / 9, within(1e-9));
    }

    @Test
    void precisionAt5_poolsTruncatedRowsAcrossUsers() {
        // A contributes 5 rows (2 clicks), B its 3 rows (1 click)
        assertThat(metrics.get(MetricSet.PRECISION_AT_5).getAsDouble()).isCloseTo(3.0 / 8, within(1e-9));
    }

    @Test
    void precisionAt10_usersShorterThanKContributeAllRows() {
        assertThat(metrics.get(MetricSet.PRECISION_AT_10).getAsDouble()).isCloseTo(3.0 / 9, within(1e-9));
    }

    @Test
    void noOutcomes_onlySampleCount() {
        MetricSet empty = calculator.calculate(ObservationFixtures.batch(
                ModelIdentity.RECOMMENDATION,
                List.of(Observation.builder().predicted(0.3).userId("A").rank(1).build())));

        assertThat(empty.asMap()).containsOnlyKeys(MetricSet.SAMPLE_COUNT);
    }
}
