package com.chicu.airetrain.trigger;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Очередь заявок: строгий порядок по приоритету, FIFO внутри уровня.
 */
@Component
public class RetrainingQueue {

    private record Slot(RetrainingRequest request, long seq) {}

    private static final Comparator<Slot> ORDER =
            Comparator.comparingInt((Slot s) -> -s.request().getPriority())
                    .thenComparingLong(Slot::seq);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final PriorityQueue<Slot> slots = new PriorityQueue<>(ORDER);
    private long seq;

    public void offer(RetrainingRequest request) {
        if (request == null) throw new IllegalArgumentException("request is null");
        lock.lock();
        try {
            slots.add(new Slot(request, seq++));
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public Optional<RetrainingRequest> poll() {
        lock.lock();
        try {
            Slot s = slots.poll();
            return s == null ? Optional.empty() : Optional.of(s.request());
        } finally {
            lock.unlock();
        }
    }

    public Optional<RetrainingRequest> peek() {
        lock.lock();
        try {
            Slot s = slots.peek();
            return s == null ? Optional.empty() : Optional.of(s.request());
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(RetrainingRequest request) {
        lock.lock();
        try {
            return slots.removeIf(s -> s.request() == request);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ждёт, пока в очереди что-то появится.
     *
     * @return true, если очередь не пуста
     */
    public boolean awaitNotEmpty(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (slots.isEmpty()) {
                if (nanos <= 0) return false;
                nanos = notEmpty.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** В порядке выдачи. */
    public List<RetrainingRequest> snapshot() {
        lock.lock();
        try {
            List<Slot> copy = new ArrayList<>(slots);
            copy.sort(ORDER);
            return copy.stream().map(Slot::request).toList();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return slots.size();
        } finally {
            lock.unlock();
        }
    }
}
