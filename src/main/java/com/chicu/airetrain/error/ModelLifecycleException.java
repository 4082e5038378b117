package com.chicu.airetrain.error;

import lombok.Getter;

@Getter
public abstract class ModelLifecycleException extends RuntimeException {

    private final FailureKind kind;

    protected ModelLifecycleException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ModelLifecycleException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
