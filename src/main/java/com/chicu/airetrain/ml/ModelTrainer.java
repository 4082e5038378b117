package com.chicu.airetrain.ml;

import com.chicu.airetrain.ml.dataset.DatasetSnapshot;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Внешний тренер. Алгоритм нас не интересует: только контракт.
 */
public interface ModelTrainer {

    /**
     * @throws com.chicu.airetrain.error.TrainingException если обучение не удалось
     */
    ModelArtifact train(DatasetSnapshot dataset, Duration timeBudget);

    /** metric name → value */
    Map<String, Double> evaluate(ModelArtifact artifact, DatasetSnapshot dataset);

    /** Предсказания по строкам dataset в том же порядке. */
    List<Double> predict(ModelArtifact artifact, DatasetSnapshot dataset);
}
