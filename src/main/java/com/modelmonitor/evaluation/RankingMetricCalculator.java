package com.modelmonitor.evaluation;

import com.modelmonitor.domain.enums.ModelFamily;
import com.modelmonitor.domain.model.MetricSet;
import com.modelmonitor.domain.model.Observation;
import com.modelmonitor.domain.model.ObservationBatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Recommendation metrics: click-through rate and precision@5 / precision@10.
 *
 * <p>Precision@K truncates each user's list to its top K items (by rank, then time) and
 * averages the clicked indicator over all truncated rows together. Users with fewer than
 * K items contribute every item they have.
 */
@Component
public class RankingMetricCalculator implements MetricCalculator {

    private static final String ANONYMOUS_USER = "";

    private static final Comparator<Observation> RANK_ORDER = Comparator.comparing(
                    Observation::getRank, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(Observation::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder()));

    @Override
    public ModelFamily family() {
        return ModelFamily.RANKING;
    }

    @Override
    public MetricSet calculate(ObservationBatch batch) {
        MetricSet.Builder metrics = MetricSet.builder(batch.size());

        Map<String, List<Observation>> byUser = new LinkedHashMap<>();
        double clicks = 0;
        int rated = 0;
        for (Observation observation : batch.getObservations()) {
            if (!observation.hasActual()) {
                continue;
            }
            clicks += clicked(observation);
            rated++;
            String user = observation.getUserId() != null ? observation.getUserId() : ANONYMOUS_USER;
            byUser.computeIfAbsent(user, k -> new ArrayList<>()).add(observation);
        }

        if (rated == 0) {
            return metrics.build();
        }

        byUser.values().forEach(list -> list.sort(RANK_ORDER));

        return metrics.put(MetricSet.CTR, clicks / rated)
                .put(MetricSet.PRECISION_AT_5, precisionAtK(byUser, 5))
                .put(MetricSet.PRECISION_AT_10, precisionAtK(byUser, 10))
                .build();
    }

    private double precisionAtK(Map<String, List<Observation>> byUser, int k) {
        double clicks = 0;
        int rows = 0;
        for (List<Observation> ranked : byUser.values()) {
            for (Observation observation : ranked.subList(0, Math.min(k, ranked.size()))) {
                clicks += clicked(observation);
                rows++;
            }
        }
        return rows == 0 ? Double.NaN : clicks / rows;
    }

    private double clicked(Observation observation) {
        return observation.getActual() > 0 ? 1.0 : 0.0;
    }
}
