package com.chicu.airetrain.error;

import java.time.Duration;

public class TrainingTimeoutException extends ModelLifecycleException {

    public TrainingTimeoutException(Duration budget) {
        super(FailureKind.TRAINING_TIMEOUT, "Обучение превысило maxTrainingDuration=" + budget);
    }
}
