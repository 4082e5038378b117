package com.chicu.airetrain.ml.sidecar;

import com.chicu.airetrain.ml.ModelArtifact;
import com.chicu.airetrain.ml.sidecar.dto.ActivateRequestDto;
import com.chicu.airetrain.ml.sidecar.dto.ActivateResponseDto;
import com.chicu.airetrain.ml.sidecar.props.MlSidecarProperties;
import com.chicu.airetrain.version.ArtifactActivator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "airetrain.serving", name = "activator", havingValue = "sidecar")
public class SidecarArtifactActivator implements ArtifactActivator {

    private final MlSidecarClient client;
    private final MlSidecarProperties props;

    @Override
    public void activate(long versionId, ModelArtifact artifact) {
        ActivateResponseDto resp = client.activate(ActivateRequestDto.builder()
                .modelKey(props.getModelKey())
                .modelPath(artifact.location())
                .versionId(versionId)
                .build());

        if (resp == null || !resp.isOk()) {
            String why = resp == null ? "null response" : resp.getMessage();
            throw new IllegalStateException("sidecar /activate отказал для v" + versionId + ": " + why);
        }
        log.info("🔁 SERVING sidecar: active -> v{} path={}", versionId, artifact.location());
    }
}
