package com.chicu.airetrain.coordinator;

import com.chicu.airetrain.trigger.RetrainingRequest;
import com.chicu.airetrain.version.ModelVersion;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Снимок для /status: состояние, очередь, Active, счётчики и сводка конфигурации.
 */
@Builder
public record CoordinatorStatus(
        Instant timestamp,
        CoordinatorState state,
        RetrainingRequest inFlight,
        List<RetrainingRequest> queued,
        RetrainingRequest lastFinished,
        ModelVersion activeVersion,
        int retainedVersions,
        Map<String, Long> counters,
        Map<String, Object> config
) {}
