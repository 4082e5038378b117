package com.chicu.airetrain.coordinator;

public enum CoordinatorState {
    IDLE,
    QUEUED,
    TRAINING,
    VALIDATING,
    PROMOTING,
    ROLLING_BACK
}
