package com.chicu.airetrain.trigger;

import com.chicu.airetrain.alert.AlertSeverity;
import com.chicu.airetrain.alert.AlertSink;
import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.error.FailureKind;
import com.chicu.airetrain.journal.AuditEntry;
import com.chicu.airetrain.journal.AuditJournal;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Сводит все источники триггеров в одну очередь координатора.
 *
 * Правила (проверяются атомарно под монитором агрегатора):
 * <ul>
 *     <li>cooldown после терминального статуса заявки той же причины;</li>
 *     <li>debounce: минимальный интервал между принятыми триггерами одной причины;</li>
 *     <li>dedup: при наличии QUEUED/RUNNING принимаем только строго более высокий приоритет,
 *     такая заявка вытесняет ждущую в очереди (та уходит в ABORTED "superseded").</li>
 * </ul>
 *
 * Координатор забирает заявки только через {@link #pollNext()} и отчитывается через
 * {@link #onFinished(RetrainingRequest)}, поэтому агрегатор всегда видит и очередь, и RUNNING.
 */
@Slf4j
@Service
public class TriggerAggregator {

    private final RetrainingQueue queue;
    private final RetrainingProperties props;
    private final AuditJournal journal;
    private final AlertSink alertSink;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<RetrainingReason, Instant> lastAccepted = new EnumMap<>(RetrainingReason.class);
    private final Map<RetrainingReason, Instant> lastTerminal = new EnumMap<>(RetrainingReason.class);

    private RetrainingRequest running;

    public TriggerAggregator(RetrainingQueue queue,
                             RetrainingProperties props,
                             AuditJournal journal,
                             AlertSink alertSink,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.queue = queue;
        this.props = props;
        this.journal = journal;
        this.alertSink = alertSink;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public TriggerDecision submit(RetrainingReason reason, String note) {
        if (reason == null) throw new IllegalArgumentException("reason is null");

        TriggerDecision decision;
        RetrainingRequest superseded = null;
        RetrainingRequest created = null;

        synchronized (this) {
            Instant now = clock.instant();
            String deny = checkCooldowns(reason, now);

            if (deny == null) {
                Optional<RetrainingRequest> queued = queue.peek();
                int highest = Math.max(
                        queued.map(RetrainingRequest::getPriority).orElse(0),
                        running != null ? running.getPriority() : 0);

                if (highest > 0 && reason.getPriority() <= highest) {
                    deny = "duplicate: pending priority " + highest + " >= " + reason.getPriority();
                } else {
                    if (queued.isPresent() && queue.remove(queued.get())) {
                        superseded = queued.get();
                        superseded.markAborted(FailureKind.ABORTED, List.of("superseded by " + reason), now);
                    }

                    created = new RetrainingRequest(newId(), reason, now, note);
                    queue.offer(created);
                    lastAccepted.put(reason, now);
                }
            }

            decision = deny != null
                    ? TriggerDecision.deny(deny)
                    : TriggerDecision.accept(created.getId(), superseded != null ? superseded.getId() : null);
        }

        count(reason, decision.accepted() ? "accepted" : "dropped");

        if (!decision.accepted()) {
            log.info("🎯 TRIGGER dropped reason={} why={}", reason, decision.reason());
            return decision;
        }

        if (superseded != null) {
            count(superseded.getReason(), "superseded");
            audit(AuditEntry.builder()
                    .timestamp(superseded.getFinishedAt())
                    .requestId(superseded.getId())
                    .reason(superseded.getReason().name())
                    .fromState(RequestStatus.QUEUED.name())
                    .toState(RequestStatus.ABORTED.name())
                    .status(RequestStatus.ABORTED.name())
                    .detail("superseded by " + created.getId())
                    .build());
            log.info("🎯 TRIGGER superseded id={} by id={}", superseded.getId(), created.getId());
        }

        audit(AuditEntry.builder()
                .timestamp(created.getCreatedAt())
                .requestId(created.getId())
                .reason(reason.name())
                .fromState(null)
                .toState(RequestStatus.QUEUED.name())
                .status(RequestStatus.QUEUED.name())
                .detail(note)
                .build());

        log.info("🎯 TRIGGER accepted id={} reason={} priority={}", created.getId(), reason, reason.getPriority());
        alertSink.notify(AlertSeverity.INFO, "Retraining triggered: " + reason,
                Map.of("requestId", created.getId(), "reason", reason.name()));

        return decision;
    }

    /**
     * Забирает следующую заявку и помечает её RUNNING. Вызывает только координатор.
     */
    public synchronized Optional<RetrainingRequest> pollNext() {
        if (running != null) return Optional.empty();

        Optional<RetrainingRequest> next = queue.poll();
        next.ifPresent(r -> {
            r.markRunning(clock.instant());
            running = r;
        });
        return next;
    }

    /**
     * Заявка дошла до терминального статуса: освобождаем слот, стартуем cooldown причины.
     */
    public synchronized void onFinished(RetrainingRequest request) {
        if (request == null) return;

        if (running == request) running = null;
        if (request.isTerminal()) {
            lastTerminal.put(request.getReason(),
                    request.getFinishedAt() != null ? request.getFinishedAt() : clock.instant());
        }
    }

    public synchronized Optional<RetrainingRequest> running() {
        return Optional.ofNullable(running);
    }

    public List<RetrainingRequest> queued() {
        return queue.snapshot();
    }

    public synchronized Optional<Instant> lastAcceptedAt(RetrainingReason reason) {
        return Optional.ofNullable(lastAccepted.get(reason));
    }

    private String checkCooldowns(RetrainingReason reason, Instant now) {
        Duration cooldown = props.getTrigger().getCooldownPeriod();
        Instant terminal = lastTerminal.get(reason);
        if (terminal != null && now.isBefore(terminal.plus(cooldown))) {
            return "cooldown after last " + reason + " until " + terminal.plus(cooldown);
        }

        Duration debounce = props.getTrigger().getTriggerCooldown();
        Instant accepted = lastAccepted.get(reason);
        if (accepted != null && now.isBefore(accepted.plus(debounce))) {
            return "debounce: last " + reason + " accepted at " + accepted;
        }
        return null;
    }

    /** Заявка уже в очереди: сбой журнала её не отменяет. */
    private void audit(AuditEntry entry) {
        try {
            journal.append(entry);
        } catch (RuntimeException e) {
            log.warn("🧾 AUDIT write failed req={} -> {}: {}", entry.requestId(), entry.toState(), e.getMessage());
        }
    }

    private void count(RetrainingReason reason, String outcome) {
        meterRegistry.counter("airetrain.triggers", "reason", reason.name(), "outcome", outcome).increment();
    }

    private static String newId() {
        return "rr-" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
