package com.chicu.airetrain.trigger;

import lombok.Builder;

@Builder
public record TriggerDecision(
        boolean accepted,
        String reason,
        String requestId,
        String supersededRequestId
) {
    public static TriggerDecision accept(String requestId, String supersededRequestId) {
        return TriggerDecision.builder()
                .accepted(true)
                .reason(supersededRequestId == null ? "OK" : "superseded " + supersededRequestId)
                .requestId(requestId)
                .supersededRequestId(supersededRequestId)
                .build();
    }

    public static TriggerDecision deny(String reason) {
        return TriggerDecision.builder().accepted(false).reason(reason).build();
    }
}
