package com.chicu.airetrain.web.dto;

import com.chicu.airetrain.version.ModelStatus;
import com.chicu.airetrain.version.ModelVersion;

import java.time.Instant;
import java.util.Map;

public record VersionView(
        long id,
        ModelStatus status,
        Instant createdAt,
        Instant archivedAt,
        String location,
        String schemaVersion,
        Map<String, Double> metrics,
        String requestId
) {
    public static VersionView from(ModelVersion v) {
        if (v == null) return null;
        return new VersionView(
                v.id(), v.status(), v.createdAt(), v.archivedAt(),
                v.artifact() != null ? v.artifact().location() : null,
                v.artifact() != null ? v.artifact().schemaVersion() : null,
                v.metrics(), v.requestId());
    }
}
