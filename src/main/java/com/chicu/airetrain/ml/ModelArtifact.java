package com.chicu.airetrain.ml;

import lombok.Builder;

import java.util.Map;

/**
 * Непрозрачная ссылка на обученную модель.
 * Оркестратор внутрь не смотрит: хранит location, сверяет schemaVersion.
 */
@Builder
public record ModelArtifact(
        String location,
        String schemaVersion,
        Map<String, Object> meta
) {
    public ModelArtifact {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }
}
