package com.modelmonitor.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Location of the external training pipeline and its HTTP time limits. */
@Data
@ConfigurationProperties(prefix = "model-monitor.trainer")
public class TrainerProperties {

    private String baseUrl = "http://localhost:8000";

    private String runPath = "/pipeline/run";

    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Kept above model-monitor.training-timeout so the scheduler's time box fires first. */
    private Duration readTimeout = Duration.ofHours(3);
}
