package com.chicu.airetrain.monitor;

import lombok.Builder;

import java.time.Instant;

/**
 * Один замер метрики. source: "production", "validation", ...
 */
@Builder
public record PerformanceSample(
        Instant timestamp,
        String metric,
        Double value,
        String source
) {
}
