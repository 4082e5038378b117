package com.chicu.airetrain.error;

public class TrainingException extends ModelLifecycleException {

    public TrainingException(String message) {
        super(FailureKind.TRAINING_ERROR, message);
    }

    public TrainingException(String message, Throwable cause) {
        super(FailureKind.TRAINING_ERROR, message, cause);
    }
}
