package com.modelmonitor.domain.enums;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The monitored model families. The {@code key} is the name the external stores use
 * (model_predictions.model_name, Redis key suffixes) and must stay stable.
 */
@Getter
@RequiredArgsConstructor
public enum ModelIdentity {
    PRICE_PREDICTION("price_prediction", ModelFamily.REGRESSION),
    DISEASE_DETECTION("disease_detection", ModelFamily.CLASSIFICATION),
    RECOMMENDATION("recommendations", ModelFamily.RANKING);

    private final String key;
    private final ModelFamily family;

    /**
     * Resolves an identity from its store key.
     *
     * @throws IllegalArgumentException if no identity uses the key
     */
    public static ModelIdentity fromKey(String key) {
        return Arrays.stream(values())
                .filter(identity -> identity.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown model key: " + key));
    }
}
