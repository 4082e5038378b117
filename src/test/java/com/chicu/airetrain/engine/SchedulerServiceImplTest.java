package com.chicu.airetrain.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerServiceImplTest {

    private final SchedulerServiceImpl scheduler = new SchedulerServiceImpl(Clock.systemUTC());

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void failingTick_keepsTaskAliveAndCountsFailure() throws Exception {
        scheduler.scheduleAtFixedRate("trigger|drift", () -> {
            throw new IllegalStateException("monitor offline");
        }, 0, 1);

        ScheduledTaskInfo info = awaitFailures("trigger|drift", 2, Duration.ofSeconds(5));

        assertEquals("trigger|drift", info.key());
        assertTrue(info.active());
        assertTrue(info.failures() >= 2);
        assertTrue(info.runs() >= info.failures());
        assertTrue(info.lastError().contains("monitor offline"));
    }

    @Test
    void rescheduleSameKey_replacesTask() {
        scheduler.scheduleAtFixedRate("guard|resources", () -> {}, 60, 60);
        scheduler.scheduleAtFixedRate("guard|resources", () -> {}, 60, 30);

        assertEquals(1, scheduler.tasks().size());
        assertEquals(30, scheduler.tasks().get(0).intervalSec());
    }

    @Test
    void cancel_removesTask() {
        scheduler.scheduleAtFixedRate("b", () -> {}, 60, 60);
        scheduler.scheduleAtFixedRate("a", () -> {}, 60, 60);

        scheduler.cancel("b");

        assertEquals(1, scheduler.tasks().size());
        assertEquals("a", scheduler.tasks().get(0).key());
    }

    @Test
    void invalidInterval_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleAtFixedRate("x", () -> {}, 0, 0));
    }

    private ScheduledTaskInfo awaitFailures(String key, long expected, Duration within) throws InterruptedException {
        long deadline = System.nanoTime() + within.toNanos();
        while (true) {
            ScheduledTaskInfo info = scheduler.tasks().stream()
                    .filter(t -> t.key().equals(key))
                    .findFirst()
                    .orElseThrow();
            if (info.failures() >= expected) {
                return info;
            }
            if (System.nanoTime() > deadline) {
                fail("failures=" + info.failures() + " < " + expected + " for key=" + key);
            }
            Thread.sleep(50);
        }
    }
}
