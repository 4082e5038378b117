package com.chicu.airetrain.version;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.coordinator.RetrainingCoordinator;
import com.chicu.airetrain.engine.SchedulerService;
import com.chicu.airetrain.error.ModelLifecycleException;
import com.chicu.airetrain.monitor.ModelMonitor;
import com.chicu.airetrain.validation.MetricDirection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * После промоушена сравнивает прод-метрику с провалидированным значением.
 * Просадка больше rollbackDropRatio в окне watchWindow: автоматический откат.
 * Каждый промоушен проверяется до первого отката.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionWatchdog {

    static final String TASK_KEY = "watchdog|promotion";
    static final String ROLLBACK_REASON = "post-promotion degradation";

    private final ModelVersionStore store;
    private final ModelMonitor monitor;
    private final RetrainingCoordinator coordinator;
    private final SchedulerService scheduler;
    private final RetrainingProperties props;
    private final Clock clock;

    private Long handledVersionId;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!props.getWatchdog().isEnabled()) {
            log.info("🐕 WATCHDOG disabled");
            return;
        }
        long every = props.getSchedule().getCheckIntervalSec();
        scheduler.scheduleAtFixedRate(TASK_KEY, this::check, every, every);
    }

    /**
     * @return true, если откат выполнен
     */
    public synchronized boolean check() {
        PromotionStep step = store.latestPromotion().orElse(null);
        if (step == null || step.previousId() == null) return false;
        if (handledVersionId != null && handledVersionId == step.promotedId()) return false;

        ModelVersion active = store.active().orElse(null);
        if (active == null || active.id() != step.promotedId()) return false;

        Instant now = clock.instant();
        if (now.isAfter(step.promotedAt().plus(props.getWatchdog().getWatchWindow()))) return false;

        String metric = props.getMonitor().getMetric();
        Double validated = active.metrics().get(metric);
        if (validated == null) return false;

        List<Double> live = monitor.valuesSince(metric, props.getMonitor().getSource(), step.promotedAt());
        if (live.size() < props.getWatchdog().getMinSamples()) return false;

        double liveMean = live.stream().mapToDouble(Double::doubleValue).average().orElse(validated);
        double drop = relativeDrop(validated, liveMean, monitor.directionOf(metric));
        if (drop <= props.getWatchdog().getRollbackDropRatio()) return false;

        handledVersionId = step.promotedId();
        log.warn("🐕 WATCHDOG v{} {} validated={} live={} drop={} -> rollback",
                active.id(), metric, validated, String.format(Locale.ROOT, "%.4f", liveMean),
                String.format(Locale.ROOT, "%.4f", drop));
        try {
            coordinator.rollback(null, ROLLBACK_REASON);
            return true;
        } catch (ModelLifecycleException | IllegalStateException e) {
            log.error("🐕 WATCHDOG rollback of v{} failed: {}", active.id(), e.getMessage());
            return false;
        }
    }

    static double relativeDrop(double validated, double live, MetricDirection direction) {
        if (validated == 0) return 0;
        double delta = direction == MetricDirection.HIGHER_IS_BETTER ? validated - live : live - validated;
        return delta / Math.abs(validated);
    }
}
