package com.chicu.airetrain.coordinator;

import com.chicu.airetrain.alert.AlertSeverity;
import com.chicu.airetrain.alert.AlertSink;
import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.error.CoordinatorBusyException;
import com.chicu.airetrain.error.FailureKind;
import com.chicu.airetrain.error.TrainingException;
import com.chicu.airetrain.error.TransientIoException;
import com.chicu.airetrain.journal.AuditEntry;
import com.chicu.airetrain.journal.InMemoryAuditJournal;
import com.chicu.airetrain.ml.ModelArtifact;
import com.chicu.airetrain.ml.ModelTrainer;
import com.chicu.airetrain.ml.dataset.DatasetSnapshot;
import com.chicu.airetrain.ml.dataset.TrainingDataSource;
import com.chicu.airetrain.testutil.MutableClock;
import com.chicu.airetrain.trigger.RequestStatus;
import com.chicu.airetrain.trigger.RetrainingQueue;
import com.chicu.airetrain.trigger.RetrainingReason;
import com.chicu.airetrain.trigger.RetrainingRequest;
import com.chicu.airetrain.trigger.TriggerAggregator;
import com.chicu.airetrain.validation.CandidateValidator;
import com.chicu.airetrain.version.ArtifactActivator;
import com.chicu.airetrain.version.ModelStatus;
import com.chicu.airetrain.version.ModelVersion;
import com.chicu.airetrain.version.ModelVersionStore;
import com.chicu.airetrain.version.RollbackManager;
import com.chicu.airetrain.version.RollbackRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RetrainingCoordinatorTest {

    @Mock private ModelTrainer trainer;
    @Mock private TrainingDataSource dataSource;
    @Mock private ArtifactActivator activator;
    @Mock private AlertSink alertSink;

    private MutableClock clock;
    private RetrainingProperties props;
    private TriggerAggregator aggregator;
    private ModelVersionStore store;
    private InMemoryAuditJournal journal;
    private RetrainingCoordinator coordinator;
    private ExecutorService testPool;

    private final ModelArtifact candidateArtifact = ModelArtifact.builder().location("m/2").schemaVersion("v1").build();
    private final DatasetSnapshot training = snapshot("train", 150);
    private final DatasetSnapshot holdout = snapshot("holdout", 20);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        props = new RetrainingProperties();
        props.getTrigger().setCooldownPeriod(Duration.ZERO);
        props.getTrigger().setTriggerCooldown(Duration.ZERO);
        props.getTraining().setDataRetryInitialDelay(Duration.ofMillis(1));
        props.getTraining().setRollbackWaitTimeout(Duration.ofSeconds(5));

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RetrainingQueue queue = new RetrainingQueue();
        journal = new InMemoryAuditJournal(props);
        aggregator = new TriggerAggregator(queue, props, journal, alertSink, registry, clock);
        store = new ModelVersionStore(activator, props, clock);
        RollbackManager rollbackManager = new RollbackManager(store, journal, alertSink, clock);
        CandidateValidator validator = new CandidateValidator(trainer, props);

        coordinator = new RetrainingCoordinator(aggregator, queue, dataSource, trainer, validator, store,
                rollbackManager, journal, alertSink, props, registry, clock);
        testPool = Executors.newCachedThreadPool();

        when(dataSource.trainingWindow()).thenReturn(training);
        when(dataSource.holdoutWindow()).thenReturn(holdout);
        when(trainer.predict(any(), any())).thenReturn(Collections.nCopies(holdout.size(), 1.0));

        store.bootstrap(ModelArtifact.builder().location("m/1").schemaVersion("v1").build(), Map.of("accuracy", 0.80));
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
        testPool.shutdownNow();
    }

    // =========================================================
    // сценарии
    // =========================================================

    @Test
    void scenarioA_betterCandidateIsPromoted() {
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(candidateArtifact, holdout)).thenReturn(Map.of("accuracy", 0.83));

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.SUCCEEDED, req.getStatus());
        ModelVersion active = store.active().orElseThrow();
        assertEquals(req.getVersionId(), active.id());
        assertEquals(0.83, active.metrics().get("accuracy"));
        assertEquals("m/2", active.artifact().location());
        assertEquals(ModelStatus.ARCHIVED, store.find(1L).orElseThrow().status());
        assertEquals(CoordinatorState.IDLE, coordinator.state());
        verify(alertSink).notify(eq(AlertSeverity.INFO), startsWith("Promoted"), anyMap());
    }

    @Test
    void scenarioB_marginalCandidateIsRejectedWithImprovementGate() {
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(candidateArtifact, holdout)).thenReturn(Map.of("accuracy", 0.81));

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.FAILED, req.getStatus());
        assertEquals(FailureKind.VALIDATION_FAILURE, req.getFailureKind());
        assertTrue(req.getFailureDetails().stream().anyMatch(d -> d.startsWith("improvement")));
        assertEquals(1L, store.active().orElseThrow().id());
        assertEquals(1, store.history().size());
        verify(alertSink).notify(eq(AlertSeverity.WARNING), startsWith("Validation failed"), anyMap());
    }

    @Test
    void scenarioC_rollbackAfterPromotionRestoresPreviousVersion() {
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(candidateArtifact, holdout)).thenReturn(Map.of("accuracy", 0.83));
        triggerAndProcess();

        RollbackRecord rec = coordinator.rollback(null, "operator");

        ModelVersion active = store.active().orElseThrow();
        assertEquals(1L, active.id());
        assertEquals(0.80, active.metrics().get("accuracy"));
        assertEquals(1L, rec.toVersionId());
        assertEquals(1, journal.rollbacks().size());
        assertEquals(CoordinatorState.IDLE, coordinator.state());
    }

    @Test
    void transitionsAreAuditedInOrder() {
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(candidateArtifact, holdout)).thenReturn(Map.of("accuracy", 0.83));

        RetrainingRequest req = triggerAndProcess();

        List<String> states = journal.recent(100).stream()
                .filter(e -> req.getId().equals(e.requestId()) && e.fromState() != null)
                .map(AuditEntry::toState)
                .toList();
        assertEquals(List.of("QUEUED", "TRAINING", "VALIDATING", "PROMOTING", "IDLE"), states);
    }

    // =========================================================
    // ошибки
    // =========================================================

    @Test
    void trainingTimeout_abortsWithoutPromotion() {
        props.getTraining().setMaxTrainingDuration(Duration.ofMillis(150));
        AtomicBoolean interrupted = new AtomicBoolean(false);
        when(trainer.train(any(), any())).thenAnswer(inv -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
            return candidateArtifact;
        });

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.ABORTED, req.getStatus());
        assertEquals(FailureKind.TRAINING_TIMEOUT, req.getFailureKind());
        assertEquals(1L, store.active().orElseThrow().id());
        verify(trainer, never()).evaluate(any(), any());
        verify(alertSink).notify(eq(AlertSeverity.CRITICAL), startsWith("Training aborted"), anyMap());
        awaitTrue(interrupted::get);
    }

    @Test
    void trainerError_failsRequest() {
        when(trainer.train(any(), any())).thenThrow(new TrainingException("diverged"));

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.FAILED, req.getStatus());
        assertEquals(FailureKind.TRAINING_ERROR, req.getFailureKind());
        assertEquals(1L, store.active().orElseThrow().id());
    }

    @Test
    void unexpectedTrainerException_isWrappedAsTrainingError() {
        when(trainer.train(any(), any())).thenThrow(new IllegalStateException("npe inside"));

        RetrainingRequest req = triggerAndProcess();

        assertEquals(FailureKind.TRAINING_ERROR, req.getFailureKind());
        assertTrue(req.getFailureDetails().get(0).contains("npe inside"));
    }

    @Test
    void notEnoughTrainingRows_failsBeforeTrainer() {
        when(dataSource.trainingWindow()).thenReturn(snapshot("train", 10));

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.FAILED, req.getStatus());
        verify(trainer, never()).train(any(), any());
    }

    @Test
    void transientIo_isRetriedThenSucceeds() {
        when(dataSource.trainingWindow())
                .thenThrow(new TransientIoException("db blip"))
                .thenReturn(training);
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(candidateArtifact, holdout)).thenReturn(Map.of("accuracy", 0.83));

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.SUCCEEDED, req.getStatus());
        verify(dataSource, times(2)).trainingWindow();
    }

    @Test
    void transientIo_exhaustedFailsRequest() {
        when(dataSource.trainingWindow()).thenThrow(new TransientIoException("db down"));

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.FAILED, req.getStatus());
        assertEquals(FailureKind.TRANSIENT_IO, req.getFailureKind());
        verify(dataSource, times(3)).trainingWindow();
    }

    @Test
    void promotionFailure_restoresBackupAndWritesRollbackRecord() {
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(candidateArtifact, holdout)).thenReturn(Map.of("accuracy", 0.90));
        doThrow(new IllegalStateException("serving rejected")).when(activator).activate(anyLong(), eq(candidateArtifact));

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.FAILED, req.getStatus());
        assertEquals(FailureKind.PROMOTION_FAILURE, req.getFailureKind());
        assertEquals(1L, store.active().orElseThrow().id());
        assertEquals(1, journal.rollbacks().size());
        assertEquals(CoordinatorState.IDLE, coordinator.state());
        assertTrue(journal.recent(100).stream().anyMatch(e -> "ROLLING_BACK".equals(e.toState())));
    }

    @Test
    void validationTimeout_isEvaluationGateFailure() {
        props.getTraining().setMaxValidationDuration(Duration.ofMillis(150));
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(any(), any())).thenAnswer(inv -> {
            Thread.sleep(10_000);
            return Map.of("accuracy", 0.99);
        });

        RetrainingRequest req = triggerAndProcess();

        assertEquals(RequestStatus.FAILED, req.getStatus());
        assertEquals(FailureKind.VALIDATION_FAILURE, req.getFailureKind());
        assertTrue(req.getFailureDetails().get(0).startsWith("evaluation"));
        assertEquals(1L, store.active().orElseThrow().id());
    }

    // =========================================================
    // прерывания и конкурентность
    // =========================================================

    @Test
    void resourceAbort_duringTraining() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        when(trainer.train(any(), any())).thenAnswer(inv -> {
            never.await();
            return candidateArtifact;
        });

        aggregator.submit(RetrainingReason.SCHEDULED, null);
        Future<Optional<RetrainingRequest>> run = testPool.submit(coordinator::processNext);
        awaitTrue(() -> coordinator.state() == CoordinatorState.TRAINING);

        assertTrue(coordinator.abortInFlight(FailureKind.RESOURCE_EXCEEDED, "cpu=0.99>0.95"));
        RetrainingRequest req = run.get(5, TimeUnit.SECONDS).orElseThrow();

        assertEquals(RequestStatus.ABORTED, req.getStatus());
        assertEquals(FailureKind.RESOURCE_EXCEEDED, req.getFailureKind());
        assertEquals(1L, store.active().orElseThrow().id());
    }

    @Test
    void abortDuringValidation_isHonouredBeforePromotion() throws Exception {
        CountDownLatch evaluating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(candidateArtifact, holdout)).thenAnswer(inv -> {
            evaluating.countDown();
            release.await();
            return Map.of("accuracy", 0.95);
        });

        aggregator.submit(RetrainingReason.MANUAL, null);
        Future<Optional<RetrainingRequest>> run = testPool.submit(coordinator::processNext);
        assertTrue(evaluating.await(5, TimeUnit.SECONDS));

        coordinator.abortInFlight(FailureKind.ABORTED, "operator");
        release.countDown();
        RetrainingRequest req = run.get(5, TimeUnit.SECONDS).orElseThrow();

        assertEquals(RequestStatus.ABORTED, req.getStatus());
        assertEquals(1L, store.active().orElseThrow().id());
        verify(activator, never()).activate(anyLong(), eq(candidateArtifact));
    }

    @Test
    void manualRollback_abortsInFlightTrainingFirst() throws Exception {
        store.promote(store.createCandidate(ModelArtifact.builder().location("m/x").schemaVersion("v1").build(), null));
        long promotedId = store.active().orElseThrow().id();

        CountDownLatch never = new CountDownLatch(1);
        when(trainer.train(any(), any())).thenAnswer(inv -> {
            never.await();
            return candidateArtifact;
        });

        aggregator.submit(RetrainingReason.SCHEDULED, null);
        Future<Optional<RetrainingRequest>> run = testPool.submit(coordinator::processNext);
        awaitTrue(() -> coordinator.state() == CoordinatorState.TRAINING);

        RollbackRecord rec = coordinator.rollback(null, "bad deploy");
        RetrainingRequest req = run.get(5, TimeUnit.SECONDS).orElseThrow();

        assertEquals(promotedId, rec.fromVersionId());
        assertEquals(1L, store.active().orElseThrow().id());
        assertEquals(RequestStatus.ABORTED, req.getStatus());
        assertEquals(FailureKind.ABORTED, req.getFailureKind());
        assertEquals(CoordinatorState.IDLE, coordinator.state());
    }

    @Test
    void rollback_whenCoordinatorNeverReturnsToIdle_isRefused() throws Exception {
        props.getTraining().setRollbackWaitTimeout(Duration.ofMillis(200));
        CountDownLatch evaluating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(trainer.train(eq(training), any())).thenReturn(candidateArtifact);
        when(trainer.evaluate(candidateArtifact, holdout)).thenAnswer(inv -> {
            evaluating.countDown();
            release.await();
            return Map.of("accuracy", 0.95);
        });

        aggregator.submit(RetrainingReason.MANUAL, null);
        Future<Optional<RetrainingRequest>> run = testPool.submit(coordinator::processNext);
        assertTrue(evaluating.await(5, TimeUnit.SECONDS));

        // валидацию посреди гейта не рвём: откат не дождётся IDLE
        assertThrows(CoordinatorBusyException.class, () -> coordinator.rollback(null, "now"));

        release.countDown();
        assertEquals(RequestStatus.ABORTED, run.get(5, TimeUnit.SECONDS).orElseThrow().getStatus());
    }

    @Test
    void singleFlight_underConcurrentProcessing() throws Exception {
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        when(trainer.train(any(), any())).thenAnswer(inv -> {
            int now = concurrent.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            concurrent.decrementAndGet();
            return candidateArtifact;
        });
        when(trainer.evaluate(any(), any())).thenReturn(Map.of("accuracy", 0.70));

        List<Future<?>> workers = new ArrayList<>();
        CountDownLatch go = new CountDownLatch(1);
        for (int i = 0; i < 8; i++) {
            workers.add(testPool.submit(() -> {
                go.await();
                for (int k = 0; k < 20; k++) {
                    aggregator.submit(k % 2 == 0 ? RetrainingReason.MANUAL : RetrainingReason.DATA_DRIFT, null);
                    coordinator.processNext();
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> w : workers) w.get(30, TimeUnit.SECONDS);

        assertEquals(1, maxConcurrent.get());
        assertEquals(CoordinatorState.IDLE, coordinator.state());
    }

    @Test
    void secondBegin_whileBusy_isRefused() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        when(trainer.train(any(), any())).thenAnswer(inv -> {
            never.await();
            return candidateArtifact;
        });

        aggregator.submit(RetrainingReason.SCHEDULED, null);
        Future<Optional<RetrainingRequest>> run = testPool.submit(coordinator::processNext);
        awaitTrue(() -> coordinator.state() == CoordinatorState.TRAINING);

        aggregator.submit(RetrainingReason.MANUAL, null);
        assertTrue(coordinator.processNext().isEmpty());
        assertEquals(1, aggregator.queued().size());

        coordinator.abortInFlight(FailureKind.ABORTED, "test done");
        run.get(5, TimeUnit.SECONDS);
    }

    @Test
    void status_reportsActiveVersionAndCounters() {
        when(trainer.train(any(), any())).thenThrow(new TrainingException("nope"));
        triggerAndProcess();

        CoordinatorStatus st = coordinator.status();

        assertEquals(CoordinatorState.IDLE, st.state());
        assertEquals(1L, st.activeVersion().id());
        assertEquals(1L, st.counters().get("failed"));
        assertEquals(RequestStatus.FAILED, st.lastFinished().getStatus());
        assertEquals(7, st.config().get("scheduleIntervalDays"));
    }

    // =========================================================
    // helpers
    // =========================================================

    private RetrainingRequest triggerAndProcess() {
        assertTrue(aggregator.submit(RetrainingReason.MANUAL, "test").accepted());
        return coordinator.processNext().orElseThrow();
    }

    private static void awaitTrue(BooleanSupplier cond) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!cond.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not reached in 5s");
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }

    private static DatasetSnapshot snapshot(String id, int rows) {
        List<List<Double>> x = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            x.add(List.of((double) i, (double) (i % 7)));
            y.add((double) (i % 2));
        }
        return DatasetSnapshot.builder()
                .datasetId(id)
                .featureNames(List.of("f1", "f2"))
                .rows(x)
                .labels(y)
                .takenAt(Instant.EPOCH)
                .build();
    }
}
