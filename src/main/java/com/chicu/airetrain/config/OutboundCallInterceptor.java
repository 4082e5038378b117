package com.chicu.airetrain.config;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;

/**
 * Проставляет User-Agent и пишет в лог медленные и упавшие исходящие вызовы.
 * Тело запроса не логируется: там датасеты.
 */
@Slf4j
public class OutboundCallInterceptor implements Interceptor {

    private final String userAgent;
    private final long slowNanos;

    public OutboundCallInterceptor(String userAgent, Duration slowCallThreshold) {
        this.userAgent = userAgent;
        this.slowNanos = slowCallThreshold.toNanos();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request().newBuilder()
                .header("User-Agent", userAgent)
                .build();

        long start = System.nanoTime();
        try {
            Response response = chain.proceed(request);
            long tookMs = elapsedMs(start);

            if (System.nanoTime() - start > slowNanos) {
                log.warn("🐢 HTTP slow {} {} -> {} took={}ms", request.method(), request.url().encodedPath(), response.code(), tookMs);
            } else {
                log.debug("🌐 HTTP {} {} -> {} took={}ms", request.method(), request.url().encodedPath(), response.code(), tookMs);
            }
            return response;
        } catch (IOException e) {
            log.warn("🌐 HTTP failed {} {} after={}ms: {}", request.method(), request.url().encodedPath(), elapsedMs(start), e.getMessage());
            throw e;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
