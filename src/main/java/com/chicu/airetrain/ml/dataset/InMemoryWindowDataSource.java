package com.chicu.airetrain.ml.dataset;

import com.chicu.airetrain.config.RetrainingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Скользящее окно размеченных строк в памяти.
 * Хвост окна (holdoutRows) уходит в held-out, остальное: в обучение.
 */
@Slf4j
@Component
public class InMemoryWindowDataSource implements TrainingDataSource {

    private final int maxRows;
    private final int holdoutRows;
    private final Clock clock;

    private final Deque<LabeledRow> window = new ArrayDeque<>();
    private volatile List<String> featureNames = List.of();

    public InMemoryWindowDataSource(RetrainingProperties props, Clock clock) {
        this.maxRows = props.getDataWindow().getMaxRows();
        this.holdoutRows = props.getDataWindow().getHoldoutRows();
        this.clock = clock;
    }

    public synchronized void setFeatureNames(List<String> names) {
        this.featureNames = names == null ? List.of() : List.copyOf(names);
    }

    /**
     * @return сколько строк реально принято (битые строки пропускаем)
     */
    public synchronized int append(List<LabeledRow> rows) {
        if (rows == null) return 0;

        int accepted = 0;
        for (LabeledRow r : rows) {
            if (!isValid(r)) continue;

            window.addLast(new LabeledRow(List.copyOf(r.features()), r.label()));
            accepted++;
            if (window.size() > maxRows) window.removeFirst();
        }

        if (accepted < rows.size()) {
            log.warn("📥 DATA: отброшено {} битых строк из {}", rows.size() - accepted, rows.size());
        }
        return accepted;
    }

    public synchronized int size() {
        return window.size();
    }

    @Override
    public synchronized DatasetSnapshot trainingWindow() {
        List<LabeledRow> all = new ArrayList<>(window);
        int cut = Math.max(0, all.size() - holdoutRows);
        return snapshot("train", all.subList(0, cut));
    }

    @Override
    public synchronized DatasetSnapshot holdoutWindow() {
        List<LabeledRow> all = new ArrayList<>(window);
        int cut = Math.max(0, all.size() - holdoutRows);
        return snapshot("holdout", all.subList(cut, all.size()));
    }

    private DatasetSnapshot snapshot(String kind, List<LabeledRow> part) {
        return DatasetSnapshot.builder()
                .datasetId(kind + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .featureNames(featureNames)
                .rows(part.stream().map(LabeledRow::features).toList())
                .labels(part.stream().map(LabeledRow::label).toList())
                .takenAt(clock.instant())
                .build();
    }

    private static boolean isValid(LabeledRow r) {
        if (r == null || r.features() == null || r.features().isEmpty() || r.label() == null) return false;
        if (!Double.isFinite(r.label())) return false;
        for (Double v : r.features()) {
            if (v == null || !Double.isFinite(v)) return false;
        }
        return true;
    }
}
