package com.chicu.airetrain.journal;

import lombok.Builder;

import java.time.Instant;

/**
 * Одна строка аудита: переход заявки/координатора.
 * requestId может быть null (ручной откат вне заявки, bootstrap).
 */
@Builder
public record AuditEntry(
        Instant timestamp,
        String requestId,
        String reason,
        String fromState,
        String toState,
        String status,
        String detail
) {}
