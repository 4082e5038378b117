package com.chicu.airetrain.ml.dataset;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Неизменяемый срез окна данных: X (rows) + y (labels).
 */
@Builder
public record DatasetSnapshot(
        String datasetId,
        List<String> featureNames,
        List<List<Double>> rows,
        List<Double> labels,
        Instant takenAt
) {
    public DatasetSnapshot {
        featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
