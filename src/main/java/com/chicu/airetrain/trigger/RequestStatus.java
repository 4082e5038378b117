package com.chicu.airetrain.trigger;

public enum RequestStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ABORTED;
    }
}
