package com.chicu.airetrain.alert;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
