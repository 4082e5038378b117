package com.chicu.airetrain.error;

/**
 * Откат невозможен: требуется вмешательство оператора.
 * Альтернативную цель НЕ подбираем.
 */
public class RollbackFailureException extends ModelLifecycleException {

    public RollbackFailureException(String message) {
        super(FailureKind.ROLLBACK_FAILURE, message);
    }

    public RollbackFailureException(String message, Throwable cause) {
        super(FailureKind.ROLLBACK_FAILURE, message, cause);
    }
}
