package com.chicu.airetrain.guard;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.coordinator.CoordinatorState;
import com.chicu.airetrain.coordinator.RetrainingCoordinator;
import com.chicu.airetrain.engine.SchedulerService;
import com.chicu.airetrain.error.FailureKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Следит за ресурсами, пока координатор в TRAINING.
 * Превышение любого порога дольше gracePeriod снимает обучение (RESOURCE_EXCEEDED).
 * Version Store не трогает.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceGuard {

    static final String TASK_KEY = "guard|resources";

    private final ResourceProbe probe;
    private final RetrainingCoordinator coordinator;
    private final SchedulerService scheduler;
    private final RetrainingProperties props;
    private final Clock clock;

    private Instant breachSince;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        RetrainingProperties.Resources cfg = props.getResources();
        if (!cfg.isEnabled()) {
            log.info("🛡 GUARD disabled");
            return;
        }
        scheduler.scheduleAtFixedRate(TASK_KEY, this::check, cfg.getCheckIntervalSec(), cfg.getCheckIntervalSec());
    }

    /**
     * Один тик проверки.
     *
     * @return true, если на этом тике запрошено прерывание
     */
    public synchronized boolean check() {
        if (coordinator.state() != CoordinatorState.TRAINING) {
            breachSince = null;
            return false;
        }

        List<String> breaches = breaches(probe.sample());
        Instant now = clock.instant();

        if (breaches.isEmpty()) {
            if (breachSince != null) log.info("🛡 GUARD back to normal");
            breachSince = null;
            return false;
        }

        if (breachSince == null) {
            breachSince = now;
            log.warn("🛡 GUARD threshold exceeded {} (grace {})", breaches, props.getResources().getGracePeriod());
            return false;
        }

        Duration over = Duration.between(breachSince, now);
        if (over.compareTo(props.getResources().getGracePeriod()) <= 0) return false;

        breachSince = null;
        String reason = "resource thresholds exceeded for " + over.toSeconds() + "s: " + breaches;
        return coordinator.abortInFlight(FailureKind.RESOURCE_EXCEEDED, reason);
    }

    private List<String> breaches(ResourceUsage u) {
        RetrainingProperties.Resources cfg = props.getResources();
        List<String> out = new ArrayList<>();
        add(out, "cpu", u.cpu(), cfg.getCpu());
        add(out, "memory", u.memory(), cfg.getMemory());
        add(out, "disk", u.disk(), cfg.getDisk());
        return out;
    }

    private static void add(List<String> out, String name, double value, double limit) {
        if (value >= 0 && value > limit) {
            out.add(String.format(Locale.ROOT, "%s=%.3f>%.3f", name, value, limit));
        }
    }
}
