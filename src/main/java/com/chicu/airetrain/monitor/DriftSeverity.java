package com.chicu.airetrain.monitor;

public enum DriftSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * CRITICAL если > 2×threshold, HIGH если > 1.5×, MEDIUM если > threshold, иначе LOW.
     */
    public static DriftSeverity classify(double score, double threshold) {
        if (score > threshold * 2) return CRITICAL;
        if (score > threshold * 1.5) return HIGH;
        if (score > threshold) return MEDIUM;
        return LOW;
    }
}
