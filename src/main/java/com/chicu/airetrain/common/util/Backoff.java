package com.chicu.airetrain.common.util;

import com.chicu.airetrain.error.TransientIoException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Экспоненциальный backoff для TransientIoException.
 * Остальные исключения пробрасываются сразу, без повторов.
 */
@Slf4j
public final class Backoff {

    private Backoff() {}

    public static <T> T retry(String what, int attempts, Duration initialDelay, Supplier<T> call) {
        if (attempts <= 0) throw new IllegalArgumentException("attempts must be > 0");

        long delayMs = initialDelay == null ? 0 : Math.max(0, initialDelay.toMillis());
        TransientIoException last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return call.get();
            } catch (TransientIoException e) {
                last = e;
                if (attempt == attempts) break;

                log.warn("🔁 RETRY {} attempt={}/{} delayMs={} cause={}", what, attempt, attempts, delayMs, e.getMessage());
                sleep(delayMs, what);
                delayMs = delayMs * 2;
            }
        }

        throw new TransientIoException(what + ": retries exhausted (" + attempts + ")", last);
    }

    private static void sleep(long ms, String what) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientIoException(what + ": interrupted during backoff", ie);
        }
    }
}
