package com.chicu.airetrain.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
public class SchedulerServiceImpl implements SchedulerService {

    private final Clock clock;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    // тики короткие: хватает двух потоков, долгую работу делает координатор
    private final ScheduledExecutorService executor = Executors.newScheduledThreadPool(2, new ThreadFactory() {
        private final AtomicInteger n = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "retrain-scheduler-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    });

    public SchedulerServiceImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, long initialDelaySec, long intervalSec) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key is blank");
        if (intervalSec <= 0) throw new IllegalArgumentException("intervalSec must be > 0");

        cancel(key);

        Slot slot = new Slot(key, intervalSec, clock.instant());
        slot.future = executor.scheduleAtFixedRate(() -> slot.tick(task),
                Math.max(0, initialDelaySec), intervalSec, TimeUnit.SECONDS);
        slots.put(key, slot);

        log.info("⏱ TICK registered key={} delay={}s every={}s", key, Math.max(0, initialDelaySec), intervalSec);
        return slot.future;
    }

    @Override
    public void cancel(String key) {
        Slot slot = slots.remove(key);
        if (slot != null && slot.future != null) {
            slot.future.cancel(false);
            log.info("🛑 TICK cancelled key={} runs={} failures={}", key, slot.runs.get(), slot.failures.get());
        }
    }

    @Override
    public List<ScheduledTaskInfo> tasks() {
        return slots.values().stream()
                .map(Slot::info)
                .sorted(Comparator.comparing(ScheduledTaskInfo::key))
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        log.info("💤 SCHEDULER shutting down, tasks={}", slots.size());
        slots.clear();
        executor.shutdownNow();
    }

    /**
     * Задача + её статистика. Исключение из scheduleAtFixedRate молча снимает задачу,
     * поэтому tick() ловит всё сам.
     */
    private final class Slot {

        private final String key;
        private final long intervalSec;
        private final Instant registeredAt;
        private final AtomicLong runs = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();

        private volatile ScheduledFuture<?> future;
        private volatile Instant lastRunAt;
        private volatile String lastError;

        private Slot(String key, long intervalSec, Instant registeredAt) {
            this.key = key;
            this.intervalSec = intervalSec;
            this.registeredAt = registeredAt;
        }

        private void tick(Runnable task) {
            lastRunAt = clock.instant();
            runs.incrementAndGet();
            try {
                task.run();
            } catch (Exception e) {
                failures.incrementAndGet();
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.error("⏱ TICK failed key={}: {}", key, e.getMessage(), e);
            }
        }

        private ScheduledTaskInfo info() {
            ScheduledFuture<?> f = future;
            return ScheduledTaskInfo.builder()
                    .key(key)
                    .intervalSec(intervalSec)
                    .registeredAt(registeredAt)
                    .lastRunAt(lastRunAt)
                    .runs(runs.get())
                    .failures(failures.get())
                    .lastError(lastError)
                    .active(f != null && !f.isCancelled() && !f.isDone())
                    .build();
        }
    }
}
