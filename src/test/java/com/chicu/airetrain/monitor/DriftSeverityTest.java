package com.chicu.airetrain.monitor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DriftSeverityTest {

    @Test
    void classify_usesThresholdMultipliers() {
        assertEquals(DriftSeverity.LOW, DriftSeverity.classify(0.1, 0.1));
        assertEquals(DriftSeverity.MEDIUM, DriftSeverity.classify(0.12, 0.1));
        assertEquals(DriftSeverity.HIGH, DriftSeverity.classify(0.16, 0.1));
        assertEquals(DriftSeverity.CRITICAL, DriftSeverity.classify(0.21, 0.1));
    }
}
