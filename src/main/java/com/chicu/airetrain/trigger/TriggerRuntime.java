package com.chicu.airetrain.trigger;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.engine.SchedulerService;
import com.chicu.airetrain.monitor.DriftReport;
import com.chicu.airetrain.monitor.ModelMonitor;
import com.chicu.airetrain.version.ModelVersion;
import com.chicu.airetrain.version.ModelVersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Три периодические проверки: расписание, деградация качества, дрейф.
 * Ошибка внутри проверки = "в этот цикл триггера нет".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriggerRuntime {

    static final String KEY_SCHEDULE = "trigger|schedule";
    static final String KEY_PERFORMANCE = "trigger|performance";
    static final String KEY_DRIFT = "trigger|drift";

    private final TriggerAggregator aggregator;
    private final ModelMonitor monitor;
    private final ModelVersionStore store;
    private final SchedulerService scheduler;
    private final RetrainingProperties props;
    private final Clock clock;

    private volatile Instant startedAt;
    private volatile Instant lastDriftSeen;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        startedAt = clock.instant();
        long every = props.getSchedule().getCheckIntervalSec();

        if (props.getSchedule().isEnabled()) {
            scheduler.scheduleAtFixedRate(KEY_SCHEDULE, () -> safe("schedule", this::checkSchedule), every, every);
        }
        scheduler.scheduleAtFixedRate(KEY_PERFORMANCE, () -> safe("performance", this::checkPerformance), every, every);
        scheduler.scheduleAtFixedRate(KEY_DRIFT, () -> safe("drift", this::checkDrift), every, every);

        log.info("🎯 TRIGGER runtime started every={}s schedule={}d", every, props.getSchedule().getIntervalDays());
    }

    /**
     * Плановый триггер: с последнего обучения (или старта) прошло intervalDays.
     */
    public Optional<TriggerDecision> checkSchedule() {
        Instant now = clock.instant();
        Instant last = lastTraining();
        if (last == null || now.isBefore(last.plus(Duration.ofDays(props.getSchedule().getIntervalDays())))) {
            return Optional.empty();
        }
        return Optional.of(aggregator.submit(RetrainingReason.SCHEDULED, "schedule interval elapsed since " + last));
    }

    public Optional<TriggerDecision> checkPerformance() {
        RetrainingProperties.Monitor m = props.getMonitor();
        if (!monitor.isPerformanceDegraded(m.getRecentWindow(), m.getHistoricalWindow(), m.getDegradationRatio())) {
            return Optional.empty();
        }
        return Optional.of(aggregator.submit(RetrainingReason.PERFORMANCE_DEGRADATION,
                m.getMetric() + " degraded on " + m.getSource()));
    }

    /**
     * Срабатывает только на новый отчёт: один и тот же отчёт дважды не триггерит.
     */
    public Optional<TriggerDecision> checkDrift() {
        Optional<DriftReport> latest = monitor.latestDrift();
        if (latest.isEmpty()) return Optional.empty();

        DriftReport r = latest.get();
        if (lastDriftSeen != null && !r.timestamp().isAfter(lastDriftSeen)) return Optional.empty();
        lastDriftSeen = r.timestamp();

        if (!monitor.isDriftExceeded(r.score(), props.getMonitor().getDriftThreshold())) {
            return Optional.empty();
        }
        return Optional.of(aggregator.submit(RetrainingReason.DATA_DRIFT,
                "drift score " + r.score() + " severity " + r.severity()));
    }

    private Instant lastTraining() {
        Instant ref = startedAt;
        Instant activeAt = store.active().map(ModelVersion::createdAt).orElse(null);
        Instant scheduled = aggregator.lastAcceptedAt(RetrainingReason.SCHEDULED).orElse(null);

        for (Instant t : new Instant[]{activeAt, scheduled}) {
            if (t != null && (ref == null || t.isAfter(ref))) ref = t;
        }
        return ref;
    }

    private void safe(String check, Supplier<Optional<TriggerDecision>> body) {
        try {
            body.get();
        } catch (Exception e) {
            log.warn("🎯 TRIGGER check '{}' failed, no trigger this cycle: {}", check, e.getMessage());
        }
    }
}
