package com.chicu.airetrain.web.dto;

import com.chicu.airetrain.error.FailureKind;
import com.chicu.airetrain.trigger.RequestStatus;
import com.chicu.airetrain.trigger.RetrainingReason;
import com.chicu.airetrain.trigger.RetrainingRequest;

import java.time.Instant;
import java.util.List;

public record RequestView(
        String id,
        RetrainingReason reason,
        int priority,
        RequestStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        FailureKind failureKind,
        List<String> failureDetails,
        Long versionId,
        String note
) {
    public static RequestView from(RetrainingRequest r) {
        if (r == null) return null;
        return new RequestView(
                r.getId(), r.getReason(), r.getPriority(), r.getStatus(),
                r.getCreatedAt(), r.getStartedAt(), r.getFinishedAt(),
                r.getFailureKind(), r.getFailureDetails(), r.getVersionId(), r.getNote());
    }
}
