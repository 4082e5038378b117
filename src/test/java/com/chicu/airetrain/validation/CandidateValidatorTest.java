package com.chicu.airetrain.validation;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.ml.ModelArtifact;
import com.chicu.airetrain.ml.ModelTrainer;
import com.chicu.airetrain.ml.dataset.DatasetSnapshot;
import com.chicu.airetrain.version.ModelStatus;
import com.chicu.airetrain.version.ModelVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CandidateValidatorTest {

    @Mock
    private ModelTrainer trainer;

    private RetrainingProperties props;
    private CandidateValidator validator;

    private final ModelArtifact artifact = ModelArtifact.builder().location("m/2").schemaVersion("v1").build();
    private final DatasetSnapshot holdout = DatasetSnapshot.builder()
            .datasetId("holdout")
            .rows(List.of(List.of(1.0), List.of(2.0), List.of(3.0), List.of(4.0)))
            .labels(List.of(0.0, 1.0, 0.0, 1.0))
            .build();

    @BeforeEach
    void setUp() {
        props = new RetrainingProperties();
        validator = new CandidateValidator(trainer, props);
    }

    @Test
    void scenarioA_improvedCandidatePassesAllGates() {
        when(trainer.evaluate(artifact, holdout)).thenReturn(Map.of("accuracy", 0.83));
        when(trainer.predict(artifact, holdout)).thenReturn(List.of(0.0, 1.0, 0.0, 1.0));

        ValidationResult r = validator.validate(artifact, holdout, active(0.80));

        assertTrue(r.passed(), () -> "unexpected failures: " + r.details());
        assertEquals(0.83, r.metrics().get("accuracy"));
        verify(trainer, times(3)).predict(artifact, holdout);
    }

    @Test
    void scenarioB_smallGainFailsImprovementGate() {
        when(trainer.evaluate(artifact, holdout)).thenReturn(Map.of("accuracy", 0.81));
        when(trainer.predict(artifact, holdout)).thenReturn(List.of(0.0, 1.0, 0.0, 1.0));

        ValidationResult r = validator.validate(artifact, holdout, active(0.80));

        assertFalse(r.passed());
        assertEquals(1, r.failures().size());
        assertTrue(r.failedGate(ValidationGate.IMPROVEMENT));
        assertTrue(r.details().get(0).startsWith("improvement: accuracy"));
    }

    @Test
    void improvementGate_skippedWithoutActiveVersion() {
        when(trainer.evaluate(artifact, holdout)).thenReturn(Map.of("accuracy", 0.76));
        when(trainer.predict(artifact, holdout)).thenReturn(List.of(0.0, 1.0, 0.0, 1.0));

        assertTrue(validator.validate(artifact, holdout, null).passed());
    }

    @Test
    void allFailingGatesAreListed() {
        ModelArtifact wrongSchema = ModelArtifact.builder().location("m/3").schemaVersion("v2").build();
        when(trainer.evaluate(wrongSchema, holdout)).thenReturn(Map.of("accuracy", 0.70));
        when(trainer.predict(wrongSchema, holdout))
                .thenReturn(List.of(0.0, 1.0, 0.0, 1.0))
                .thenReturn(List.of(1.0, 0.0, 1.0, 0.0))
                .thenReturn(List.of(0.0, 1.0, 0.0, 1.0));

        ValidationResult r = validator.validate(wrongSchema, holdout, active(0.80));

        assertFalse(r.passed());
        assertTrue(r.failedGate(ValidationGate.IMPROVEMENT));
        assertTrue(r.failedGate(ValidationGate.MINIMUM_REQUIREMENT));
        assertTrue(r.failedGate(ValidationGate.STABILITY));
        assertTrue(r.failedGate(ValidationGate.COMPATIBILITY));
        assertEquals(4, r.failures().size());
    }

    @Test
    void lowerIsBetterMetric_usesReversedComparisons() {
        RetrainingProperties.MetricGate rmse = new RetrainingProperties.MetricGate();
        rmse.setDirection(MetricDirection.LOWER_IS_BETTER);
        rmse.setImprovementThreshold(0.05);
        rmse.setMinimum(0.5);
        props.getValidation().setMetrics(Map.of("rmse", rmse));

        when(trainer.evaluate(artifact, holdout)).thenReturn(Map.of("rmse", 0.40));
        when(trainer.predict(artifact, holdout)).thenReturn(List.of(0.0, 1.0, 0.0, 1.0));

        ModelVersion activeRmse = active(0.80).withMetrics(Map.of("rmse", 0.48));
        assertTrue(validator.validate(artifact, holdout, activeRmse).passed());

        ModelVersion barelyWorse = active(0.80).withMetrics(Map.of("rmse", 0.43));
        ValidationResult r = validator.validate(artifact, holdout, barelyWorse);
        assertTrue(r.failedGate(ValidationGate.IMPROVEMENT));
        assertFalse(r.failedGate(ValidationGate.MINIMUM_REQUIREMENT));
    }

    @Test
    void evaluateFailure_isEvaluationGate() {
        when(trainer.evaluate(any(), any())).thenThrow(new IllegalStateException("sidecar down"));
        when(trainer.predict(artifact, holdout)).thenReturn(List.of(0.0, 1.0, 0.0, 1.0));

        ValidationResult r = validator.validate(artifact, holdout, active(0.80));

        assertFalse(r.passed());
        assertTrue(r.failedGate(ValidationGate.EVALUATION));
        assertFalse(r.failedGate(ValidationGate.IMPROVEMENT));
    }

    @Test
    void emptyHoldout_failsStability() {
        DatasetSnapshot empty = DatasetSnapshot.builder().datasetId("e").build();
        when(trainer.evaluate(artifact, empty)).thenReturn(Map.of("accuracy", 0.9));

        ValidationResult r = validator.validate(artifact, empty, null);

        assertTrue(r.failedGate(ValidationGate.STABILITY));
        verify(trainer, never()).predict(any(), any());
    }

    @Test
    void agreementRate_countsRowsWhereAllRunsAgree() {
        List<List<Double>> runs = List.of(
                List.of(1.0, 2.0, 3.0, 4.0),
                List.of(1.0, 2.0, 3.5, 4.0),
                List.of(1.0, 2.0, 3.0, 4.0));

        assertEquals(0.75, CandidateValidator.agreementRate(runs, 4, 1e-9), 1e-12);
        assertEquals(0.0, CandidateValidator.agreementRate(List.of(List.of(1.0)), 4, 1e-9), 1e-12);
    }

    private static ModelVersion active(double accuracy) {
        return ModelVersion.builder()
                .id(1)
                .createdAt(Instant.EPOCH)
                .artifact(ModelArtifact.builder().location("m/1").schemaVersion("v1").build())
                .metrics(Map.of("accuracy", accuracy))
                .status(ModelStatus.ACTIVE)
                .build();
    }
}
