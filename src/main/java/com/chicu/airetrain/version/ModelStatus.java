package com.chicu.airetrain.version;

public enum ModelStatus {
    CANDIDATE,
    ACTIVE,
    ARCHIVED,
    REJECTED
}
