package com.chicu.airetrain.error;

/**
 * Прогон прерван снаружи: ручной откат, остановка приложения.
 */
public class RetrainingAbortedException extends ModelLifecycleException {

    public RetrainingAbortedException(String message) {
        super(FailureKind.ABORTED, message);
    }
}
