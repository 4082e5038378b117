package com.chicu.airetrain.trigger;

import lombok.Getter;

/**
 * Причина переобучения. Приоритет выводится из причины:
 * MANUAL = PERFORMANCE_DEGRADATION > DATA_DRIFT > SCHEDULED.
 */
@Getter
public enum RetrainingReason {

    SCHEDULED(1),
    DATA_DRIFT(2),
    PERFORMANCE_DEGRADATION(3),
    MANUAL(3);

    private final int priority;

    RetrainingReason(int priority) {
        this.priority = priority;
    }
}
