package com.chicu.airetrain.engine;

import lombok.Builder;

import java.time.Instant;

@Builder
public record ScheduledTaskInfo(
        String key,
        long intervalSec,
        Instant registeredAt,
        Instant lastRunAt,
        long runs,
        long failures,
        String lastError,
        boolean active
) {}
