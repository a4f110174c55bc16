package com.modelmonitor.exception;

import com.modelmonitor.domain.enums.ModelIdentity;
import java.util.Map;
import lombok.Getter;

/**
 * Raised before any metric is computed when a batch holds fewer observations than the
 * model's minimum. Recovered by the caller into an INSUFFICIENT_DATA result.
 */
@Getter
public class InsufficientDataException extends BaseException {

    private final ModelIdentity modelIdentity;
    private final int sampleCount;
    private final int minSamples;

    public InsufficientDataException(ModelIdentity modelIdentity, int sampleCount, int minSamples) {
        super(
                ErrorCode.INSUFFICIENT_DATA,
                "Insufficient data for " + modelIdentity.getKey() + ": " + sampleCount + " samples, "
                        + minSamples + " required",
                Map.of("model", modelIdentity.getKey(), "sampleCount", sampleCount, "minSamples", minSamples));
        this.modelIdentity = modelIdentity;
        this.sampleCount = sampleCount;
        this.minSamples = minSamples;
    }
}
