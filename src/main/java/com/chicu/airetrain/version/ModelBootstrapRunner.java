package com.chicu.airetrain.version;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.ml.ModelArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * Регистрирует начальную Active версию из airetrain.bootstrap.*, если store пуст.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnExpression("!'${airetrain.bootstrap.artifact-location:}'.isBlank()")
public class ModelBootstrapRunner implements ApplicationRunner {

    private final ModelVersionStore store;
    private final RetrainingProperties props;

    @Override
    public void run(ApplicationArguments args) {
        if (store.active().isPresent()) return;

        RetrainingProperties.Bootstrap cfg = props.getBootstrap();
        ModelArtifact artifact = ModelArtifact.builder()
                .location(cfg.getArtifactLocation())
                .schemaVersion(cfg.getSchemaVersion())
                .build();

        store.bootstrap(artifact, cfg.getMetrics());
    }
}
