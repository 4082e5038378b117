package com.chicu.airetrain.coordinator;

import com.chicu.airetrain.alert.AlertSeverity;
import com.chicu.airetrain.alert.AlertSink;
import com.chicu.airetrain.common.util.Backoff;
import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.error.CoordinatorBusyException;
import com.chicu.airetrain.error.FailureKind;
import com.chicu.airetrain.error.ModelLifecycleException;
import com.chicu.airetrain.error.PromotionFailureException;
import com.chicu.airetrain.error.RetrainingAbortedException;
import com.chicu.airetrain.error.TrainingException;
import com.chicu.airetrain.error.TrainingTimeoutException;
import com.chicu.airetrain.journal.AuditEntry;
import com.chicu.airetrain.journal.AuditJournal;
import com.chicu.airetrain.ml.ModelArtifact;
import com.chicu.airetrain.ml.ModelTrainer;
import com.chicu.airetrain.ml.dataset.DatasetSnapshot;
import com.chicu.airetrain.ml.dataset.TrainingDataSource;
import com.chicu.airetrain.trigger.RequestStatus;
import com.chicu.airetrain.trigger.RetrainingQueue;
import com.chicu.airetrain.trigger.RetrainingRequest;
import com.chicu.airetrain.trigger.TriggerAggregator;
import com.chicu.airetrain.validation.CandidateValidator;
import com.chicu.airetrain.validation.ValidationGate;
import com.chicu.airetrain.validation.ValidationResult;
import com.chicu.airetrain.version.ModelVersion;
import com.chicu.airetrain.version.ModelVersionStore;
import com.chicu.airetrain.version.RollbackManager;
import com.chicu.airetrain.version.RollbackRecord;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-flight state machine переобучения.
 *
 * <pre>
 * IDLE → QUEUED → TRAINING → VALIDATING → PROMOTING → IDLE
 *                     │            │           └→ ROLLING_BACK → IDLE  (promotion failure)
 *                     └→ IDLE      └→ IDLE (reject / abort)
 * IDLE → ROLLING_BACK → IDLE  (ручной откат)
 * </pre>
 *
 * Выход из IDLE возможен только под {@link #lock}, поэтому одновременно идёт не больше одной заявки.
 * Пайплайн крутится на одном рабочем потоке, обучение и валидация: на отдельном пуле,
 * чтобы ожидание можно было ограничить по времени и отменить.
 */
@Slf4j
@Service
public class RetrainingCoordinator {

    static final String MDC_KEY = "retrain_request_id";

    private final TriggerAggregator aggregator;
    private final RetrainingQueue queue;
    private final TrainingDataSource dataSource;
    private final ModelTrainer trainer;
    private final CandidateValidator validator;
    private final ModelVersionStore store;
    private final RollbackManager rollbackManager;
    private final AuditJournal journal;
    private final AlertSink alertSink;
    private final RetrainingProperties props;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private final AtomicReference<CoordinatorState> state = new AtomicReference<>(CoordinatorState.IDLE);

    private volatile InFlightRun inFlight;
    private volatile RetrainingRequest lastFinished;

    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong aborted = new AtomicLong();
    private final AtomicLong rollbacks = new AtomicLong();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "retrain-coordinator");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService trainingPool = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger n = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "retrain-trainer-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    });

    public RetrainingCoordinator(TriggerAggregator aggregator,
                                 RetrainingQueue queue,
                                 TrainingDataSource dataSource,
                                 ModelTrainer trainer,
                                 CandidateValidator validator,
                                 ModelVersionStore store,
                                 RollbackManager rollbackManager,
                                 AuditJournal journal,
                                 AlertSink alertSink,
                                 RetrainingProperties props,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.aggregator = aggregator;
        this.queue = queue;
        this.dataSource = dataSource;
        this.trainer = trainer;
        this.validator = validator;
        this.store = store;
        this.rollbackManager = rollbackManager;
        this.journal = journal;
        this.alertSink = alertSink;
        this.props = props;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    // =========================================================
    // lifecycle
    // =========================================================

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) return;
        worker.submit(this::loop);
        log.info("🧠 COORDINATOR started");
    }

    @PreDestroy
    public void shutdown() {
        log.info("💤 COORDINATOR shutting down…");
        abortInFlight(FailureKind.ABORTED, "shutdown");
        worker.shutdownNow();
        trainingPool.shutdownNow();
    }

    private void loop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                if (queue.awaitNotEmpty(Duration.ofSeconds(1)) && processNext().isEmpty()) {
                    // очередь не пуста, но координатор занят откатом
                    Thread.sleep(200);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("🔥 COORDINATOR loop error: {}", e.getMessage(), e);
            }
        }
        log.info("🧠 COORDINATOR loop stopped");
    }

    // =========================================================
    // pipeline
    // =========================================================

    /**
     * Забирает одну заявку и проводит её до терминального статуса в текущем потоке.
     *
     * @return обработанная заявка; пусто, если очередь пуста или координатор не в IDLE
     */
    public Optional<RetrainingRequest> processNext() {
        InFlightRun run;

        lock.lock();
        try {
            if (state.get() != CoordinatorState.IDLE) return Optional.empty();

            Optional<RetrainingRequest> next = aggregator.pollNext();
            if (next.isEmpty()) return Optional.empty();

            run = new InFlightRun(next.get());
            inFlight = run;
            transition(run, CoordinatorState.QUEUED, "dequeued");
        } finally {
            lock.unlock();
        }

        execute(run);
        return Optional.of(run.getRequest());
    }

    private void execute(InFlightRun run) {
        RetrainingRequest req = run.getRequest();
        MDC.put(MDC_KEY, req.getId());
        try {
            log.info("🧠 RETRAIN START id={} reason={}", req.getId(), req.getReason());
            transition(run, CoordinatorState.TRAINING, null);
            alertSink.notify(AlertSeverity.INFO, "Training started", ctx(req));

            ModelArtifact artifact = train(run);
            if (run.isAbortRequested()) throw run.abortException();

            ModelVersion candidate = store.createCandidate(artifact, req.getId());
            transition(run, CoordinatorState.VALIDATING, "candidate v" + candidate.id());

            DatasetSnapshot holdout = Backoff.retry("holdoutWindow",
                    props.getTraining().getDataRetryAttempts(),
                    props.getTraining().getDataRetryInitialDelay(),
                    dataSource::holdoutWindow);

            ModelVersion active = store.active().orElse(null);
            ValidationResult result = validate(artifact, holdout, active);
            candidate = candidate.withMetrics(result.metrics());

            // валидацию не рвём посреди гейта, но до промоушена прерывание учитываем
            if (run.isAbortRequested()) {
                store.reject(candidate);
                throw run.abortException();
            }

            if (!result.passed()) {
                store.reject(candidate);
                finish(run, RequestStatus.FAILED, FailureKind.VALIDATION_FAILURE, result.details(), null);
                Map<String, Object> c = ctx(req);
                c.put("gates", result.details());
                alertSink.notify(AlertSeverity.WARNING, "Validation failed for v" + candidate.id(), c);
                return;
            }

            transition(run, CoordinatorState.PROMOTING, "v" + candidate.id() + " metrics=" + result.metrics());
            ModelVersion promoted;
            try {
                promoted = store.promote(candidate);
            } catch (PromotionFailureException e) {
                transition(run, CoordinatorState.ROLLING_BACK, e.getMessage());
                rollbackManager.recordPromotionFailure(candidate, e);
                rollbacks.incrementAndGet();
                finish(run, RequestStatus.FAILED, FailureKind.PROMOTION_FAILURE, List.of(e.getMessage()), null);
                return;
            }

            finish(run, RequestStatus.SUCCEEDED, null, List.of(), promoted.id());
            Map<String, Object> c = ctx(req);
            c.put("versionId", promoted.id());
            c.put("metrics", promoted.metrics());
            alertSink.notify(AlertSeverity.INFO, "Promoted v" + promoted.id(), c);

        } catch (ModelLifecycleException e) {
            handleFailure(run, e);
        } catch (RuntimeException e) {
            log.error("🔥 RETRAIN unexpected error id={}: {}", req.getId(), e.getMessage(), e);
            finish(run, RequestStatus.FAILED, FailureKind.TRAINING_ERROR, List.of(String.valueOf(e.getMessage())), null);
            alertSink.notify(AlertSeverity.CRITICAL, "Retraining crashed: " + e.getMessage(), ctx(req));
        } finally {
            release(run);
            MDC.remove(MDC_KEY);
        }
    }

    private ModelArtifact train(InFlightRun run) {
        RetrainingProperties.Training cfg = props.getTraining();

        DatasetSnapshot data = Backoff.retry("trainingWindow",
                cfg.getDataRetryAttempts(), cfg.getDataRetryInitialDelay(), dataSource::trainingWindow);

        int minRows = props.getDataWindow().getMinTrainingRows();
        if (data.size() < minRows) {
            throw new TrainingException("not enough training rows: " + data.size() + " < " + minRows);
        }

        Duration budget = cfg.getMaxTrainingDuration();
        Future<ModelArtifact> f = trainingPool.submit(() -> trainer.train(data, budget));
        run.attachTraining(f);

        try {
            ModelArtifact artifact = f.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            if (artifact == null) throw new TrainingException("trainer returned no artifact");
            return artifact;
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new TrainingTimeoutException(budget);
        } catch (CancellationException e) {
            throw run.abortException();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelLifecycleException mle) throw mle;
            throw new TrainingException("trainer failed: " + (cause != null ? cause.getMessage() : "unknown"), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            throw new RetrainingAbortedException("coordinator interrupted");
        } finally {
            run.detachTraining();
        }
    }

    private ValidationResult validate(ModelArtifact artifact, DatasetSnapshot holdout, ModelVersion active) {
        Duration budget = props.getTraining().getMaxValidationDuration();
        Future<ValidationResult> f = trainingPool.submit(() -> validator.validate(artifact, holdout, active));

        try {
            return f.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            return ValidationResult.failed(ValidationGate.EVALUATION, "validation timed out after " + budget);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return ValidationResult.failed(ValidationGate.EVALUATION,
                    "validation error: " + (cause != null ? cause.getMessage() : "unknown"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return ValidationResult.failed(ValidationGate.EVALUATION, "validation interrupted");
        }
    }

    private void handleFailure(InFlightRun run, ModelLifecycleException e) {
        RetrainingRequest req = run.getRequest();
        FailureKind kind = e.getKind();
        List<String> details = List.of(String.valueOf(e.getMessage()));

        switch (kind) {
            case TRAINING_TIMEOUT, RESOURCE_EXCEEDED -> {
                log.warn("⛔ RETRAIN ABORTED id={} kind={} msg={}", req.getId(), kind, e.getMessage());
                finish(run, RequestStatus.ABORTED, kind, details, null);
                alertSink.notify(AlertSeverity.CRITICAL, "Training aborted: " + kind + " " + e.getMessage(), ctx(req));
            }
            case ABORTED -> {
                log.warn("⛔ RETRAIN ABORTED id={} msg={}", req.getId(), e.getMessage());
                finish(run, RequestStatus.ABORTED, kind, details, null);
                alertSink.notify(AlertSeverity.WARNING, "Retraining aborted: " + e.getMessage(), ctx(req));
            }
            default -> {
                log.warn("❌ RETRAIN FAILED id={} kind={} msg={}", req.getId(), kind, e.getMessage());
                finish(run, RequestStatus.FAILED, kind, details, null);
                alertSink.notify(AlertSeverity.WARNING, "Training failed: " + e.getMessage(), ctx(req));
            }
        }
    }

    private void finish(InFlightRun run, RequestStatus status, FailureKind kind, List<String> details, Long versionId) {
        RetrainingRequest req = run.getRequest();
        switch (status) {
            case SUCCEEDED -> {
                req.markSucceeded(versionId, clock.instant());
                succeeded.incrementAndGet();
            }
            case FAILED -> {
                req.markFailed(kind, details, clock.instant());
                failed.incrementAndGet();
            }
            case ABORTED -> {
                req.markAborted(kind, details, clock.instant());
                aborted.incrementAndGet();
            }
            default -> throw new IllegalArgumentException("not terminal: " + status);
        }
        meterRegistry.counter("airetrain.requests", "status", status.name()).increment();
        log.info("🏁 RETRAIN END id={} status={} kind={} details={}", req.getId(), status, kind, details);
    }

    /**
     * Терминальная заявка уже записана; освобождаем слот и возвращаемся в IDLE.
     */
    private void release(InFlightRun run) {
        RetrainingRequest req = run.getRequest();

        if (!req.isTerminal()) {
            // сюда попадаем только если упал сам finish
            req.markAborted(FailureKind.ABORTED, List.of("coordinator error"), clock.instant());
            aborted.incrementAndGet();
        }

        aggregator.onFinished(req);
        lastFinished = req;

        lock.lock();
        try {
            inFlight = null;
            transition(run, CoordinatorState.IDLE, req.getStatus().name());
            idle.signalAll();
        } finally {
            lock.unlock();
        }
    }

    // =========================================================
    // abort / rollback
    // =========================================================

    /**
     * Просит текущий прогон остановиться. Обучение прерывается сразу, валидация: перед промоушеном.
     *
     * @return false, если прогона нет или прерывание уже запрошено
     */
    public boolean abortInFlight(FailureKind kind, String reason) {
        InFlightRun run = inFlight;
        if (run == null) return false;

        boolean first = run.requestAbort(kind, reason);
        if (first) {
            log.warn("⛔ ABORT requested id={} kind={} reason={} state={}",
                    run.getRequest().getId(), kind, reason, state.get());
        }
        return first;
    }

    /**
     * Ручной откат: прерывает текущий прогон, ждёт IDLE, затем IDLE → ROLLING_BACK → IDLE.
     *
     * @throws CoordinatorBusyException если координатор не вернулся в IDLE за rollbackWaitTimeout
     * @throws com.chicu.airetrain.error.RollbackFailureException если цель не удержана
     */
    public RollbackRecord rollback(Long targetVersionId, String reason) {
        String why = reason == null || reason.isBlank() ? "manual" : reason;
        long deadline = System.nanoTime() + props.getTraining().getRollbackWaitTimeout().toNanos();

        lock.lock();
        try {
            while (state.get() != CoordinatorState.IDLE) {
                abortInFlight(FailureKind.ABORTED, "rollback requested: " + why);
                long left = deadline - System.nanoTime();
                if (left <= 0) {
                    throw new CoordinatorBusyException("coordinator is " + state.get() + ", rollback refused");
                }
                idle.awaitNanos(left);
            }
            transition(null, CoordinatorState.ROLLING_BACK, why);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoordinatorBusyException("interrupted while waiting for IDLE");
        } finally {
            lock.unlock();
        }

        try {
            RollbackRecord record = rollbackManager.rollback(targetVersionId, why);
            rollbacks.incrementAndGet();
            return record;
        } finally {
            lock.lock();
            try {
                transition(null, CoordinatorState.IDLE, "rollback done");
                idle.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * @return true, если координатор в IDLE до истечения timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (state.get() != CoordinatorState.IDLE) {
                if (nanos <= 0) return false;
                nanos = idle.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    // =========================================================
    // status
    // =========================================================

    public CoordinatorState state() {
        return state.get();
    }

    public Optional<RetrainingRequest> inFlight() {
        InFlightRun run = inFlight;
        return run == null ? Optional.empty() : Optional.of(run.getRequest());
    }

    public CoordinatorStatus status() {
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("succeeded", succeeded.get());
        counters.put("failed", failed.get());
        counters.put("aborted", aborted.get());
        counters.put("rollbacks", rollbacks.get());

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("scheduleIntervalDays", props.getSchedule().getIntervalDays());
        config.put("performanceDegradationRatio", props.getMonitor().getDegradationRatio());
        config.put("performanceAbsoluteFloor", props.getMonitor().getAbsoluteFloor());
        config.put("driftThreshold", props.getMonitor().getDriftThreshold());
        config.put("maxTrainingDuration", props.getTraining().getMaxTrainingDuration().toString());
        config.put("stabilityThreshold", props.getValidation().getStabilityThreshold());
        config.put("maxVersions", props.getVersions().getMaxVersions());
        config.put("backupRetentionDays", props.getVersions().getBackupRetentionDays());
        config.put("cooldownPeriod", props.getTrigger().getCooldownPeriod().toString());
        config.put("triggerCooldown", props.getTrigger().getTriggerCooldown().toString());

        return CoordinatorStatus.builder()
                .timestamp(clock.instant())
                .state(state.get())
                .inFlight(inFlight().orElse(null))
                .queued(aggregator.queued())
                .lastFinished(lastFinished)
                .activeVersion(store.active().orElse(null))
                .retainedVersions(store.history().size())
                .counters(counters)
                .config(config)
                .build();
    }

    // =========================================================
    // helpers
    // =========================================================

    private void transition(InFlightRun run, CoordinatorState to, String detail) {
        CoordinatorState from = state.getAndSet(to);
        RetrainingRequest req = run != null ? run.getRequest() : null;

        log.debug("🔀 STATE {} -> {} req={} detail={}", from, to, req != null ? req.getId() : null, detail);
        try {
            journal.append(AuditEntry.builder()
                    .timestamp(clock.instant())
                    .requestId(req != null ? req.getId() : null)
                    .reason(req != null ? req.getReason().name() : null)
                    .fromState(from.name())
                    .toState(to.name())
                    .status(req != null ? req.getStatus().name() : null)
                    .detail(detail)
                    .build());
        } catch (RuntimeException e) {
            log.warn("🧾 AUDIT write failed {} -> {}: {}", from, to, e.getMessage());
        }
    }

    private static Map<String, Object> ctx(RetrainingRequest req) {
        Map<String, Object> c = new LinkedHashMap<>();
        c.put("requestId", req.getId());
        c.put("reason", req.getReason().name());
        return c;
    }
}
