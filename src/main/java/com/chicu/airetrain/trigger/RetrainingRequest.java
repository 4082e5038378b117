package com.chicu.airetrain.trigger;

import com.chicu.airetrain.error.FailureKind;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Заявка на переобучение.
 *
 * Статус меняет только владелец: очередь/агрегатор (QUEUED, ABORTED "superseded")
 * и координатор (RUNNING и терминальные). Поля volatile: их читают REST и watchdog.
 */
@Getter
public class RetrainingRequest {

    private final String id;
    private final RetrainingReason reason;
    private final Instant createdAt;
    private final String note;

    private volatile RequestStatus status = RequestStatus.QUEUED;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile FailureKind failureKind;
    private volatile List<String> failureDetails = List.of();
    private volatile Long versionId;

    public RetrainingRequest(String id, RetrainingReason reason, Instant createdAt, String note) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (reason == null) throw new IllegalArgumentException("reason is required");
        this.id = id;
        this.reason = reason;
        this.createdAt = createdAt;
        this.note = note;
    }

    public int getPriority() {
        return reason.getPriority();
    }

    synchronized void markRunning(Instant now) {
        requireStatus(RequestStatus.QUEUED);
        this.status = RequestStatus.RUNNING;
        this.startedAt = now;
    }

    public synchronized void markSucceeded(long versionId, Instant now) {
        requireStatus(RequestStatus.RUNNING);
        this.versionId = versionId;
        finish(RequestStatus.SUCCEEDED, null, List.of(), now);
    }

    public synchronized void markFailed(FailureKind kind, List<String> details, Instant now) {
        requireStatus(RequestStatus.RUNNING);
        finish(RequestStatus.FAILED, kind, details, now);
    }

    /** Прерывание допустимо и из очереди (superseded), и во время работы. */
    public synchronized void markAborted(FailureKind kind, List<String> details, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("request " + id + " already " + status);
        }
        finish(RequestStatus.ABORTED, kind, details, now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void finish(RequestStatus st, FailureKind kind, List<String> details, Instant now) {
        this.status = st;
        this.failureKind = kind;
        this.failureDetails = details == null ? List.of() : List.copyOf(details);
        this.finishedAt = now;
    }

    private void requireStatus(RequestStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("request " + id + " is " + status + ", expected " + expected);
        }
    }

    @Override
    public String toString() {
        return "RetrainingRequest{" + id + " " + reason + " " + status + "}";
    }
}
