package com.chicu.airetrain.monitor;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.validation.MetricDirection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Скользящие окна метрик прода и отчётов о дрейфе.
 *
 * Монитор никогда не бросает исключения вызывающему: битые сэмплы
 * отбрасываются и считаются в airetrain.monitor.rejected.
 */
@Slf4j
@Service
public class ModelMonitor {

    private final RetrainingProperties props;
    private final Counter rejected;

    /** key = metric|source */
    private final Map<String, Deque<PerformanceSample>> performance = new HashMap<>();
    private final Deque<DriftReport> drift = new ArrayDeque<>();

    public ModelMonitor(RetrainingProperties props, MeterRegistry meterRegistry) {
        this.props = props;
        this.rejected = Counter.builder("airetrain.monitor.rejected")
                .description("Отброшенные битые сэмплы/отчёты")
                .register(meterRegistry);
    }

    // =========================================================
    // запись
    // =========================================================

    public void recordPerformance(PerformanceSample sample) {
        if (!isValid(sample)) {
            reject("performance", sample);
            return;
        }
        synchronized (performance) {
            Deque<PerformanceSample> q = performance.computeIfAbsent(
                    key(sample.metric(), sample.source()), k -> new ArrayDeque<>());
            q.addLast(sample);
            while (q.size() > props.getMonitor().getMaxSamples()) q.removeFirst();
        }
    }

    public void recordDrift(DriftReport report) {
        if (report == null || report.timestamp() == null || report.score() == null
                || !Double.isFinite(report.score()) || report.score() < 0) {
            reject("drift", report);
            return;
        }

        DriftReport stored = report.severity() != null
                ? report
                : report.toBuilder()
                        .severity(DriftSeverity.classify(report.score(), props.getMonitor().getDriftThreshold()))
                        .build();

        synchronized (drift) {
            drift.addLast(stored);
            while (drift.size() > props.getMonitor().getMaxSamples()) drift.removeFirst();
        }
    }

    // =========================================================
    // сигналы
    // =========================================================

    /**
     * Деградация по настроенной метрике/источнику/полу.
     */
    public boolean isPerformanceDegraded(int recentWindow, int historicalWindow, double ratioThreshold) {
        RetrainingProperties.Monitor m = props.getMonitor();
        return isPerformanceDegraded(m.getMetric(), m.getSource(), recentWindow, historicalWindow,
                ratioThreshold, m.getAbsoluteFloor(), directionOf(m.getMetric()));
    }

    /**
     * Среднее последних N против среднего предыдущих M.
     * Нужны ОБА условия: относительное падение и пробитие абсолютного пола.
     * Сэмплов меньше N+M: false.
     */
    public boolean isPerformanceDegraded(String metric,
                                         String source,
                                         int recentWindow,
                                         int historicalWindow,
                                         double ratioThreshold,
                                         double absoluteFloor,
                                         MetricDirection direction) {
        if (recentWindow <= 0 || historicalWindow <= 0) return false;

        List<Double> values = values(metric, source);
        if (values.size() < recentWindow + historicalWindow) return false;

        int end = values.size();
        double recentMean = mean(values.subList(end - recentWindow, end));
        double historicalMean = mean(values.subList(end - recentWindow - historicalWindow, end - recentWindow));

        if (direction == MetricDirection.LOWER_IS_BETTER) {
            return recentMean > historicalMean / ratioThreshold && recentMean > absoluteFloor;
        }
        return recentMean < historicalMean * ratioThreshold && recentMean < absoluteFloor;
    }

    public boolean isDriftExceeded(double latestScore, double threshold) {
        return latestScore > threshold;
    }

    public Optional<DriftReport> latestDrift() {
        synchronized (drift) {
            return Optional.ofNullable(drift.peekLast());
        }
    }

    public List<DriftReport> recentDrift(int limit) {
        synchronized (drift) {
            List<DriftReport> all = new ArrayList<>(drift);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public List<PerformanceSample> recentPerformance(String metric, String source, int limit) {
        synchronized (performance) {
            Deque<PerformanceSample> q = performance.get(key(metric, source));
            if (q == null) return List.of();
            List<PerformanceSample> all = new ArrayList<>(q);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    /** Значения метрики, записанные не раньше since (для watchdog после промоушена). */
    public List<Double> valuesSince(String metric, String source, Instant since) {
        synchronized (performance) {
            Deque<PerformanceSample> q = performance.get(key(metric, source));
            if (q == null) return List.of();
            return q.stream()
                    .filter(s -> !s.timestamp().isBefore(since))
                    .map(PerformanceSample::value)
                    .toList();
        }
    }

    public long rejectedCount() {
        return (long) rejected.count();
    }

    public MetricDirection directionOf(String metric) {
        var gate = props.getValidation().getMetrics().get(metric);
        return gate != null && gate.getDirection() != null ? gate.getDirection() : MetricDirection.HIGHER_IS_BETTER;
    }

    // =========================================================
    // helpers
    // =========================================================

    private List<Double> values(String metric, String source) {
        synchronized (performance) {
            Deque<PerformanceSample> q = performance.get(key(metric, source));
            if (q == null) return List.of();
            return q.stream().map(PerformanceSample::value).toList();
        }
    }

    private void reject(String kind, Object payload) {
        rejected.increment();
        if (log.isDebugEnabled()) {
            log.debug("📉 MONITOR reject {}: {}", kind, payload);
        }
    }

    private static boolean isValid(PerformanceSample s) {
        return s != null
                && s.timestamp() != null
                && s.metric() != null && !s.metric().isBlank()
                && s.source() != null && !s.source().isBlank()
                && s.value() != null && Double.isFinite(s.value());
    }

    private static String key(String metric, String source) {
        return (metric == null ? "" : metric.trim()) + "|" + (source == null ? "" : source.trim());
    }

    static double mean(List<Double> xs) {
        double s = 0;
        for (double x : xs) s += x;
        return s / xs.size();
    }
}
