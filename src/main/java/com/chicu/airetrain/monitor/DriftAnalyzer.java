package com.chicu.airetrain.monitor;

import com.chicu.airetrain.config.RetrainingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Строит {@link DriftReport} по колонкам фич: baseline vs current.
 * Агрегат: среднее по фичам, которые есть в обеих выборках.
 */
@Slf4j
@Service
public class DriftAnalyzer {

    private final Map<String, DriftScorer> scorers = new LinkedHashMap<>();
    private final RetrainingProperties props;
    private final Clock clock;

    public DriftAnalyzer(List<DriftScorer> scorerList, RetrainingProperties props, Clock clock) {
        for (DriftScorer s : scorerList) {
            DriftScorer prev = scorers.put(s.method().toLowerCase(Locale.ROOT), s);
            if (prev != null) {
                log.warn("⚠️ Два скорера для '{}': {} и {}. Использую последний.",
                        s.method(), prev.getClass().getSimpleName(), s.getClass().getSimpleName());
            }
        }
        this.props = props;
        this.clock = clock;
    }

    public DriftReport analyze(Map<String, List<Double>> baseline, Map<String, List<Double>> current) {
        return analyze(baseline, current, props.getMonitor().getDriftMethod());
    }

    public DriftReport analyze(Map<String, List<Double>> baseline,
                               Map<String, List<Double>> current,
                               String method) {

        DriftScorer scorer = scorers.get(method == null ? "" : method.trim().toLowerCase(Locale.ROOT));
        if (scorer == null) {
            throw new IllegalArgumentException("Неизвестный drift method: " + method + ", есть: " + scorers.keySet());
        }

        Map<String, Double> perFeature = new LinkedHashMap<>();
        if (baseline != null && current != null) {
            for (Map.Entry<String, List<Double>> e : baseline.entrySet()) {
                List<Double> cur = current.get(e.getKey());
                if (cur == null || e.getValue() == null) continue;
                List<Double> b = finite(e.getValue());
                List<Double> c = finite(cur);
                if (b.isEmpty() || c.isEmpty()) continue;
                perFeature.put(e.getKey(), scorer.score(b, c));
            }
        }

        double aggregate = perFeature.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double threshold = props.getMonitor().getDriftThreshold();

        return DriftReport.builder()
                .timestamp(clock.instant())
                .score(aggregate)
                .featureScores(perFeature)
                .severity(DriftSeverity.classify(aggregate, threshold))
                .build();
    }

    private static List<Double> finite(List<Double> xs) {
        return xs.stream().filter(v -> v != null && Double.isFinite(v)).toList();
    }
}
