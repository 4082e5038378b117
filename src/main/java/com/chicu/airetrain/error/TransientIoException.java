package com.chicu.airetrain.error;

public class TransientIoException extends ModelLifecycleException {

    public TransientIoException(String message) {
        super(FailureKind.TRANSIENT_IO, message);
    }

    public TransientIoException(String message, Throwable cause) {
        super(FailureKind.TRANSIENT_IO, message, cause);
    }
}
