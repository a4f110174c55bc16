package com.modelmonitor.config;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.ModelThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Monitoring loop and threshold configuration.
 *
 * <p>Reads from application.yml:
 * <pre>
 * model-monitor.interval=6h
 * model-monitor.backoff=60s
 * model-monitor.lookback-days=7
 * model-monitor.max-attempts=3
 * model-monitor.drift.bins=10
 * model-monitor.thresholds.price-prediction.max-mape-percent=15
 * model-monitor.thresholds-file=${MODEL_MONITOR_THRESHOLDS_FILE:}
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "model-monitor")
public class MonitoringProperties {

    /** Models evaluated every cycle. */
    @NotEmpty
    private List<ModelIdentity> models = new ArrayList<>(Arrays.asList(ModelIdentity.values()));

    /** Pause between the end of one drain phase and the start of the next evaluation. */
    @NotNull
    private Duration interval = Duration.ofHours(6);

    @NotNull
    private Duration initialDelay = Duration.ofSeconds(30);

    /** Pause after a loop-level failure before the next attempt. */
    @NotNull
    private Duration backoff = Duration.ofSeconds(60);

    /** How long stop() waits for the running phase to finish. */
    @NotNull
    private Duration shutdownTimeout = Duration.ofMinutes(2);

    @Min(1)
    private int lookbackDays = 7;

    @Min(1)
    private int baselineWindowDays = 30;

    @NotNull
    private Duration evaluationTimeout = Duration.ofMinutes(5);

    @NotNull
    private Duration trainingTimeout = Duration.ofHours(2);

    /** Training attempts a job gets before it is abandoned. */
    @Min(1)
    private int maxAttempts = 3;

    @Min(1)
    private int dashboardRecordLimit = 10;

    @Valid
    private Drift drift = new Drift();

    @Valid
    private Map<ModelIdentity, ModelThresholds> thresholds = new EnumMap<>(ModelIdentity.class);

    /** Optional YAML file re-read between cycles; its entries replace the configured ones per model. */
    private String thresholdsFile;

    @Data
    public static class Drift {

        @Min(1)
        private int bins = 10;

        /** Upper bound on reference values kept per feature in a baseline. */
        @Min(10)
        private int referenceSampleSize = 2000;

        /** Replace the baseline after a successful retrain. Off by default: baselines are frozen. */
        private boolean resetBaselineAfterRetrain = false;
    }
}
