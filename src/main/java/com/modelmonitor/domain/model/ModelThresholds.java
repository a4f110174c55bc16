package com.modelmonitor.domain.model;

import com.modelmonitor.domain.enums.ModelFamily;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Monitoring limits for one model.
 *
 * <p>{@code minSamples} and {@code maxDriftPsi} apply to every family. Each family then has
 * two required limits (checked by {@link #missingRequiredLimits(ModelFamily)} at load time)
 * and one optional limit where null means the check is disabled.
 *
 * <p>Percent limits ({@code maxMapePercent}, {@code minDirectionalAccuracyPercent}) are on a
 * 0-100 scale; the classification and ranking limits are fractions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelThresholds {

    @NotNull
    @Min(1)
    private Integer minSamples;

    @NotNull
    @DecimalMin("0.0")
    private Double maxDriftPsi;

    // ==================== Regression ====================

    private Double maxMapePercent;

    private Double minDirectionalAccuracyPercent;

    /** Optional. */
    private Double maxRmse;

    // ==================== Classification ====================

    private Double minAccuracy;

    private Double minF1Score;

    /** Optional. */
    private Double minRecall;

    // ==================== Ranking ====================

    private Double minPrecisionAt5;

    private Double minCtr;

    /** Optional. */
    private Double minPrecisionAt10;

    /** Names of the limits this family needs that are not set. Empty when the thresholds are usable. */
    public List<String> missingRequiredLimits(ModelFamily family) {
        List<String> missing = new ArrayList<>();
        switch (family) {
            case REGRESSION -> {
                if (maxMapePercent == null) {
                    missing.add("max-mape-percent");
                }
                if (minDirectionalAccuracyPercent == null) {
                    missing.add("min-directional-accuracy-percent");
                }
            }
            case CLASSIFICATION -> {
                if (minAccuracy == null) {
                    missing.add("min-accuracy");
                }
                if (minF1Score == null) {
                    missing.add("min-f1-score");
                }
            }
            case RANKING -> {
                if (minPrecisionAt5 == null) {
                    missing.add("min-precision-at5");
                }
                if (minCtr == null) {
                    missing.add("min-ctr");
                }
            }
        }
        return missing;
    }
}
