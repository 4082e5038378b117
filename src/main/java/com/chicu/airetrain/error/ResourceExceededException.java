package com.chicu.airetrain.error;

public class ResourceExceededException extends ModelLifecycleException {

    public ResourceExceededException(String message) {
        super(FailureKind.RESOURCE_EXCEEDED, message);
    }
}
