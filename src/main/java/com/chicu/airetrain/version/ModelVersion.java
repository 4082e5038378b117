package com.chicu.airetrain.version;

import com.chicu.airetrain.ml.ModelArtifact;
import lombok.Builder;
import lombok.With;

import java.time.Instant;
import java.util.Map;

/**
 * Версия модели. Неизменяемая: смена статуса = новый экземпляр через with*.
 */
@With
@Builder(toBuilder = true)
public record ModelVersion(
        long id,
        Instant createdAt,
        ModelArtifact artifact,
        Map<String, Double> metrics,
        ModelStatus status,
        Instant archivedAt,
        String requestId
) {
    public ModelVersion {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
