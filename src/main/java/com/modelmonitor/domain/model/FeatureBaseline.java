package com.modelmonitor.domain.model;

import com.modelmonitor.domain.enums.ModelIdentity;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Reference feature distributions a model's live inputs are compared against.
 * Captured once per model and never replaced automatically.
 */
@Value
@Builder
@Jacksonized
public class FeatureBaseline {

    ModelIdentity modelIdentity;
    LocalDateTime capturedAt;
    int windowDays;
    Map<String, FeatureDistribution> features;
}
