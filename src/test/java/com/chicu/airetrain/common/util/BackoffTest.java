package com.chicu.airetrain.common.util;

import com.chicu.airetrain.error.TrainingException;
import com.chicu.airetrain.error.TransientIoException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void returnsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        String out = Backoff.retry("load", 3, Duration.ofMillis(1), () -> {
            if (calls.incrementAndGet() < 3) throw new TransientIoException("blip");
            return "ok";
        });

        assertEquals("ok", out);
        assertEquals(3, calls.get());
    }

    @Test
    void exhaustedRetries_keepLastCause() {
        AtomicInteger calls = new AtomicInteger();

        TransientIoException ex = assertThrows(TransientIoException.class,
                () -> Backoff.retry("load", 2, Duration.ZERO, () -> {
                    calls.incrementAndGet();
                    throw new TransientIoException("down");
                }));

        assertEquals(2, calls.get());
        assertTrue(ex.getMessage().contains("retries exhausted"));
        assertEquals("down", ex.getCause().getMessage());
    }

    @Test
    void otherErrors_areNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TrainingException.class, () -> Backoff.retry("train", 5, Duration.ZERO, () -> {
            calls.incrementAndGet();
            throw new TrainingException("bad data");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void zeroAttempts_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Backoff.retry("x", 0, Duration.ZERO, () -> 1));
    }
}
