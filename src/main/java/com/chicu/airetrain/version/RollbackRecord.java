package com.chicu.airetrain.version;

import lombok.Builder;

import java.time.Instant;

/**
 * Запись об откате. Только добавляется, никогда не меняется.
 */
@Builder
public record RollbackRecord(
        Instant timestamp,
        Long fromVersionId,
        Long toVersionId,
        String reason
) {}
