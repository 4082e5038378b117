package com.chicu.airetrain.coordinator;

import com.chicu.airetrain.engine.ScheduledTaskInfo;
import com.chicu.airetrain.engine.SchedulerService;
import com.chicu.airetrain.version.ModelVersionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * /actuator/health → components.retraining.
 * UP всегда. Отсутствие Active версии штатно до первого обучения.
 * Упавшие тики видны в details.ticks, статус они не роняют.
 */
@Component
@RequiredArgsConstructor
public class RetrainingHealthIndicator implements HealthIndicator {

    private final RetrainingCoordinator coordinator;
    private final ModelVersionStore store;
    private final SchedulerService scheduler;

    @Override
    public Health health() {
        Map<String, Object> ticks = new LinkedHashMap<>();
        for (ScheduledTaskInfo t : scheduler.tasks()) {
            ticks.put(t.key(), t.failures() > 0
                    ? "runs=" + t.runs() + " failures=" + t.failures() + " last=" + t.lastError()
                    : "runs=" + t.runs());
        }

        return Health.up()
                .withDetail("state", coordinator.state().name())
                .withDetail("activeVersion", store.active().map(v -> "v" + v.id()).orElse("none"))
                .withDetail("inFlight", coordinator.inFlight().map(r -> r.getId()).orElse("none"))
                .withDetail("ticks", ticks)
                .build();
    }
}
