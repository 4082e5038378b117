package com.chicu.airetrain.version;

import com.chicu.airetrain.ml.ModelArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Serving path читает Active напрямую из {@link ModelVersionStore}, внешний хук не нужен.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "airetrain.serving", name = "activator", havingValue = "noop", matchIfMissing = true)
public class NoopArtifactActivator implements ArtifactActivator {

    @Override
    public void activate(long versionId, ModelArtifact artifact) {
        log.info("🔁 SERVING: active -> v{} ({})", versionId, artifact != null ? artifact.location() : "null");
    }
}
