package com.modelmonitor.trainer;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.TrainingResult;

/** Runs the retraining pipeline for one model. May block for a long time. */
public interface Trainer {

    /**
     * @return SUCCESS with the new model's metrics, or ERROR with the pipeline's message
     * @throws RuntimeException if the pipeline cannot be reached
     */
    TrainingResult train(ModelIdentity modelIdentity);
}
