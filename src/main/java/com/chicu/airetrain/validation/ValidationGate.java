package com.chicu.airetrain.validation;

public enum ValidationGate {
    IMPROVEMENT,
    MINIMUM_REQUIREMENT,
    STABILITY,
    COMPATIBILITY,
    /** Таймаут или ошибка самой фазы валидации. */
    EVALUATION
}
