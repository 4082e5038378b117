package com.chicu.airetrain.ml.sidecar;

import com.chicu.airetrain.error.TrainingException;
import com.chicu.airetrain.ml.ModelArtifact;
import com.chicu.airetrain.ml.ModelTrainer;
import com.chicu.airetrain.ml.dataset.DatasetSnapshot;
import com.chicu.airetrain.ml.sidecar.dto.EvaluateRequestDto;
import com.chicu.airetrain.ml.sidecar.dto.EvaluateResponseDto;
import com.chicu.airetrain.ml.sidecar.dto.PredictResponseDto;
import com.chicu.airetrain.ml.sidecar.dto.TrainRequestDto;
import com.chicu.airetrain.ml.sidecar.dto.TrainResponseDto;
import com.chicu.airetrain.ml.sidecar.props.MlSidecarProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Тренер поверх python sidecar: /train, /evaluate, /predict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SidecarModelTrainer implements ModelTrainer {

    private final MlSidecarClient client;
    private final MlSidecarProperties props;

    @Override
    public ModelArtifact train(DatasetSnapshot dataset, Duration timeBudget) {
        if (dataset == null || dataset.isEmpty()) {
            throw new TrainingException("dataset пустой");
        }

        TrainRequestDto req = TrainRequestDto.builder()
                .modelKey(props.getModelKey())
                .featureNames(dataset.featureNames())
                .X(dataset.rows())
                .y(dataset.labels())
                .timeBudgetMs(timeBudget.toMillis())
                .meta(Map.of("datasetId", String.valueOf(dataset.datasetId())))
                .build();

        TrainResponseDto resp = client.train(req);

        if (resp == null || !resp.isOk() || resp.getModelPath() == null || resp.getModelPath().isBlank()) {
            log.warn("🧠 TRAIN FAIL modelKey={} resp={}", props.getModelKey(), resp);
            throw new TrainingException("sidecar /train: " + (resp == null ? "null response" : resp.getMessage()));
        }

        log.info("🧠 TRAIN OK modelKey={} modelPath={} modelVersion={} schema={}",
                props.getModelKey(), resp.getModelPath(), resp.getModelVersion(), resp.getSchemaVersion());

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("datasetId", dataset.datasetId());
        if (resp.getModelVersion() != null) meta.put("sidecarVersion", resp.getModelVersion());

        return ModelArtifact.builder()
                .location(resp.getModelPath())
                .schemaVersion(resp.getSchemaVersion())
                .meta(meta)
                .build();
    }

    @Override
    public Map<String, Double> evaluate(ModelArtifact artifact, DatasetSnapshot dataset) {
        EvaluateResponseDto resp = client.evaluate(request(artifact, dataset, true));
        if (resp == null || !resp.isOk()) {
            throw new IllegalStateException("sidecar /evaluate: " + (resp == null ? "null response" : resp.getMessage()));
        }
        return resp.getMetrics() == null ? Map.of() : resp.getMetrics();
    }

    @Override
    public List<Double> predict(ModelArtifact artifact, DatasetSnapshot dataset) {
        PredictResponseDto resp = client.predict(request(artifact, dataset, false));
        if (resp == null || !resp.isOk()) {
            throw new IllegalStateException("sidecar /predict: " + (resp == null ? "null response" : resp.getMessage()));
        }
        return resp.getPredictions() == null ? List.of() : resp.getPredictions();
    }

    private static EvaluateRequestDto request(ModelArtifact artifact, DatasetSnapshot dataset, boolean withLabels) {
        return EvaluateRequestDto.builder()
                .modelPath(artifact.location())
                .featureNames(dataset.featureNames())
                .X(dataset.rows())
                .y(withLabels ? dataset.labels() : null)
                .build();
    }
}
