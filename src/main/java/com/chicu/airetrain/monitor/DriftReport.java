package com.chicu.airetrain.monitor;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder(toBuilder = true)
public record DriftReport(
        Instant timestamp,
        Double score,
        Map<String, Double> featureScores,
        DriftSeverity severity
) {
    public DriftReport {
        featureScores = featureScores == null ? Map.of() : Map.copyOf(featureScores);
    }
}
