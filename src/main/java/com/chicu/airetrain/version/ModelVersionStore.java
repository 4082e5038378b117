package com.chicu.airetrain.version;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.error.PromotionFailureException;
import com.chicu.airetrain.error.RollbackFailureException;
import com.chicu.airetrain.ml.ModelArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Единственный владелец указателя Active и истории версий.
 *
 * Все переходы в/из Active идут под {@link #lock}; читатели видят Active через
 * {@link AtomicReference}, поэтому никогда не наблюдают промежуточного состояния.
 * Кандидаты в историю не попадают, пока их не промоутят.
 */
@Slf4j
@Service
public class ModelVersionStore {

    private final ArtifactActivator activator;
    private final RetrainingProperties props;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<ModelVersion> active = new AtomicReference<>();

    /** id → версия (Active + Archived) */
    private final TreeMap<Long, ModelVersion> history = new TreeMap<>();

    /** Стек промоушенов, ещё не откаченных. */
    private final Deque<PromotionStep> promotions = new ArrayDeque<>();

    public ModelVersionStore(ArtifactActivator activator, RetrainingProperties props, Clock clock) {
        this.activator = activator;
        this.props = props;
        this.clock = clock;
    }

    // =========================================================
    // чтение
    // =========================================================

    public Optional<ModelVersion> active() {
        return Optional.ofNullable(active.get());
    }

    public Optional<ModelVersion> find(long id) {
        lock.lock();
        try {
            return Optional.ofNullable(history.get(id));
        } finally {
            lock.unlock();
        }
    }

    /** Удерживаемые версии по возрастанию id. */
    public List<ModelVersion> history() {
        lock.lock();
        try {
            return List.copyOf(history.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<PromotionStep> latestPromotion() {
        lock.lock();
        try {
            return Optional.ofNullable(promotions.peekFirst());
        } finally {
            lock.unlock();
        }
    }

    // =========================================================
    // кандидаты
    // =========================================================

    public ModelVersion createCandidate(ModelArtifact artifact, String requestId) {
        if (artifact == null) throw new IllegalArgumentException("artifact is null");

        return ModelVersion.builder()
                .id(sequence.incrementAndGet())
                .createdAt(clock.instant())
                .artifact(artifact)
                .metrics(Map.of())
                .status(ModelStatus.CANDIDATE)
                .requestId(requestId)
                .build();
    }

    public ModelVersion reject(ModelVersion candidate) {
        ModelVersion rejected = candidate.withStatus(ModelStatus.REJECTED);
        log.info("🗑 VERSION v{} rejected (req={})", rejected.id(), rejected.requestId());
        return rejected;
    }

    // =========================================================
    // bootstrap / promote / rollback
    // =========================================================

    /**
     * Регистрирует начальную Active версию. Только для пустого store.
     */
    public ModelVersion bootstrap(ModelArtifact artifact, Map<String, Double> metrics) {
        lock.lock();
        try {
            if (active.get() != null) {
                throw new IllegalStateException("store already has active version v" + active.get().id());
            }

            ModelVersion v = createCandidate(artifact, null)
                    .withMetrics(metrics)
                    .withStatus(ModelStatus.ACTIVE);

            activator.activate(v.id(), v.artifact());
            history.put(v.id(), v);
            active.set(v);

            log.info("🚀 VERSION bootstrap v{} location={} metrics={}", v.id(), artifact.location(), v.metrics());
            return v;
        } finally {
            lock.unlock();
        }
    }

    /**
     * (a) бэкап текущей Active, (b) её архивация, (c) активация кандидата на serving path.
     * Если (c) упал: бэкап возвращается на serving path, Active не меняется.
     *
     * @throws PromotionFailureException если активация кандидата не удалась
     */
    public ModelVersion promote(ModelVersion candidate) {
        if (candidate == null || candidate.status() != ModelStatus.CANDIDATE) {
            throw new IllegalArgumentException("only CANDIDATE can be promoted: " + candidate);
        }

        lock.lock();
        try {
            ModelVersion backup = active.get();
            Instant now = clock.instant();

            try {
                activator.activate(candidate.id(), candidate.artifact());
            } catch (RuntimeException e) {
                restoreServing(backup);
                throw new PromotionFailureException(
                        "activation of v" + candidate.id() + " failed, restored v" + (backup != null ? backup.id() : null)
                                + ": " + e.getMessage(), e);
            }

            ModelVersion promoted = candidate.withStatus(ModelStatus.ACTIVE);
            if (backup != null) {
                history.put(backup.id(), backup.withStatus(ModelStatus.ARCHIVED).withArchivedAt(now));
            }
            history.put(promoted.id(), promoted);
            active.set(promoted);
            promotions.push(new PromotionStep(backup != null ? backup.id() : null, promoted.id(), now));
            trimToCapacity();

            log.info("✅ VERSION promoted v{} (prev=v{})", promoted.id(), backup != null ? backup.id() : null);
            return promoted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param targetId null: откат последнего неоткаченного промоушена; иначе конкретная удержанная версия
     * @throws RollbackFailureException цель неизвестна, вытеснена или не активируется; запасной цели нет
     */
    public RollbackRecord rollback(Long targetId, String reason) {
        lock.lock();
        try {
            ModelVersion current = active.get();
            if (current == null) {
                throw new RollbackFailureException("no active version to roll back from");
            }

            PromotionStep step = null;
            long resolved;
            if (targetId == null) {
                step = promotions.peekFirst();
                if (step == null || step.previousId() == null) {
                    throw new RollbackFailureException("no promotion to revert");
                }
                resolved = step.previousId();
            } else {
                resolved = targetId;
            }

            if (resolved == current.id()) {
                throw new RollbackFailureException("v" + resolved + " is already active");
            }

            ModelVersion target = history.get(resolved);
            if (target == null) {
                throw new RollbackFailureException("target v" + resolved + " is not retained");
            }

            try {
                activator.activate(target.id(), target.artifact());
            } catch (RuntimeException e) {
                restoreServing(current);
                throw new RollbackFailureException("activation of v" + resolved + " failed: " + e.getMessage(), e);
            }

            Instant now = clock.instant();
            history.put(current.id(), current.withStatus(ModelStatus.ARCHIVED).withArchivedAt(now));
            ModelVersion restored = target.withStatus(ModelStatus.ACTIVE).withArchivedAt(null);
            history.put(restored.id(), restored);
            active.set(restored);

            PromotionStep top = promotions.peekFirst();
            if (step != null || (top != null && top.previousId() != null && top.previousId() == resolved)) {
                promotions.pollFirst();
            }
            trimToCapacity();

            log.warn("⏪ VERSION rollback v{} -> v{} reason={}", current.id(), restored.id(), reason);
            return RollbackRecord.builder()
                    .timestamp(now)
                    .fromVersionId(current.id())
                    .toVersionId(restored.id())
                    .reason(reason)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // =========================================================
    // retention
    // =========================================================

    /**
     * Вытесняет Archived старше backupRetentionDays (с момента архивации) и сверх maxVersions.
     * Лимит по количеству держится и на promote/rollback, здесь он только добирается.
     * Active не вытесняется никогда.
     *
     * @return id вытесненных версий
     */
    public List<Long> enforceRetention() {
        RetrainingProperties.Versions cfg = props.getVersions();
        Instant cutoff = clock.instant().minus(Duration.ofDays(cfg.getBackupRetentionDays()));

        lock.lock();
        try {
            List<Long> evicted = new ArrayList<>();

            List<ModelVersion> archived = history.values().stream()
                    .filter(v -> v.status() == ModelStatus.ARCHIVED)
                    .sorted(Comparator.comparing(ModelVersion::archivedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                            .thenComparingLong(ModelVersion::id))
                    .toList();

            for (ModelVersion v : archived) {
                boolean expired = v.archivedAt() != null && v.archivedAt().isBefore(cutoff);
                boolean overflow = history.size() > cfg.getMaxVersions();
                if (expired || overflow) {
                    history.remove(v.id());
                    evicted.add(v.id());
                }
            }

            if (!evicted.isEmpty()) {
                dropStepsTo(evicted);
                log.info("🧹 VERSION retention evicted={} retained={}", evicted, history.size());
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /** Под lock: самые старые Archived уходят, пока history > maxVersions; стек шагов не глубже maxVersions. */
    private void trimToCapacity() {
        int max = Math.max(1, props.getVersions().getMaxVersions());
        while (promotions.size() > max) {
            promotions.pollLast();
        }
        if (history.size() <= max) return;

        List<ModelVersion> archived = history.values().stream()
                .filter(v -> v.status() == ModelStatus.ARCHIVED)
                .sorted(Comparator.comparing(ModelVersion::archivedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparingLong(ModelVersion::id))
                .toList();

        List<Long> evicted = new ArrayList<>();
        for (ModelVersion v : archived) {
            if (history.size() <= max) break;
            history.remove(v.id());
            evicted.add(v.id());
        }

        if (!evicted.isEmpty()) {
            dropStepsTo(evicted);
            log.info("🧹 VERSION capacity evicted={} retained={} max={}", evicted, history.size(), max);
        }
    }

    /** Шаги, откат которых вёл бы на вытесненную версию, больше не нужны. */
    private void dropStepsTo(List<Long> evicted) {
        promotions.removeIf(step -> step.previousId() != null && evicted.contains(step.previousId()));
    }

    private void restoreServing(ModelVersion backup) {
        if (backup == null) return;
        try {
            activator.activate(backup.id(), backup.artifact());
        } catch (RuntimeException e) {
            log.error("🔥 VERSION failed to re-activate backup v{}: {}", backup.id(), e.getMessage(), e);
        }
    }
}
