package com.chicu.airetrain.engine;

import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Периодические тики оркестратора по строковому ключу: триггеры, guard, watchdog, retention.
 * Сам по себе ничего не знает о переобучении.
 */
public interface SchedulerService {

    /**
     * Запускает (или перезапускает) периодическую задачу.
     * Исключение внутри задачи логируется и не останавливает следующие тики.
     *
     * @param key             уникальный ключ задачи (например: "trigger|drift")
     * @param initialDelaySec задержка перед первым тиком, сек
     * @param intervalSec     интервал между тиками, сек
     */
    ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, long initialDelaySec, long intervalSec);

    void cancel(String key);

    /** Снимок зарегистрированных задач, отсортированный по ключу. */
    List<ScheduledTaskInfo> tasks();
}
