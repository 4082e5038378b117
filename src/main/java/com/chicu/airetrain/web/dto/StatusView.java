package com.chicu.airetrain.web.dto;

import com.chicu.airetrain.coordinator.CoordinatorState;
import com.chicu.airetrain.coordinator.CoordinatorStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record StatusView(
        Instant timestamp,
        CoordinatorState state,
        RequestView inFlight,
        List<RequestView> queued,
        RequestView lastFinished,
        VersionView activeVersion,
        int retainedVersions,
        Map<String, Long> counters,
        Map<String, Object> config
) {
    public static StatusView from(CoordinatorStatus s) {
        return new StatusView(
                s.timestamp(),
                s.state(),
                RequestView.from(s.inFlight()),
                s.queued().stream().map(RequestView::from).toList(),
                RequestView.from(s.lastFinished()),
                VersionView.from(s.activeVersion()),
                s.retainedVersions(),
                s.counters(),
                s.config());
    }
}
