package com.modelmonitor.support;

import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.TrainingResult;
import com.modelmonitor.trainer.Trainer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** {@link Trainer} whose behaviour is a function of the model. Records every call. */
public class FakeTrainer implements Trainer {

    private final Function<ModelIdentity, TrainingResult> behaviour;
    private final List<ModelIdentity> calls = new ArrayList<>();

    public FakeTrainer(Function<ModelIdentity, TrainingResult> behaviour) {
        this.behaviour = behaviour;
    }

    public static FakeTrainer succeeding() {
        return new FakeTrainer(model -> TrainingResult.success(Map.of("mape", 5.0)));
    }

    public static FakeTrainer failing(String error) {
        return new FakeTrainer(model -> TrainingResult.error(error));
    }

    @Override
    public synchronized TrainingResult train(ModelIdentity modelIdentity) {
        calls.add(modelIdentity);
        return behaviour.apply(modelIdentity);
    }

    public synchronized List<ModelIdentity> getCalls() {
        return List.copyOf(calls);
    }
}
