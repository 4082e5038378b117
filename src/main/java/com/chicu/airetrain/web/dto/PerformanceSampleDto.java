package com.chicu.airetrain.web.dto;

import java.time.Instant;

/**
 * Без bean validation: битые сэмплы отбрасывает и считает монитор.
 * timestamp/source по умолчанию: "сейчас" и "production".
 */
public record PerformanceSampleDto(
        Instant timestamp,
        String metric,
        Double value,
        String source
) {}
