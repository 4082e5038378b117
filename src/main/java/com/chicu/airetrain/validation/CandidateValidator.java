package com.chicu.airetrain.validation;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.ml.ModelArtifact;
import com.chicu.airetrain.ml.ModelTrainer;
import com.chicu.airetrain.ml.dataset.DatasetSnapshot;
import com.chicu.airetrain.version.ModelVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Прогоняет кандидата через все гейты и собирает ВСЕ провалы, без короткого замыкания.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateValidator {

    /** Погрешность сравнения прироста с порогом (0.83 - 0.80 в double = 0.0299...). */
    private static final double EPS = 1e-9;

    private final ModelTrainer trainer;
    private final RetrainingProperties props;

    /**
     * @param active текущая Active версия, null: гейт улучшения пропускается
     */
    public ValidationResult validate(ModelArtifact artifact, DatasetSnapshot holdout, ModelVersion active) {
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(holdout, "holdout");

        List<GateFailure> failures = new ArrayList<>();
        Map<String, Double> metrics = Map.of();

        try {
            Map<String, Double> m = trainer.evaluate(artifact, holdout);
            metrics = m != null ? m : Map.of();
        } catch (RuntimeException e) {
            log.warn("🧪 VALIDATE evaluate failed: {}", e.getMessage());
            failures.add(new GateFailure(ValidationGate.EVALUATION, "evaluate failed: " + e.getMessage()));
        }

        if (!failures.isEmpty()) {
            // без метрик improvement/minimum проверять нечем, но stability и compatibility всё равно считаем
            checkStability(artifact, holdout, failures);
            checkCompatibility(artifact, failures);
            return new ValidationResult(metrics, failures);
        }

        checkImprovement(metrics, active, failures);
        checkMinimums(metrics, failures);
        checkStability(artifact, holdout, failures);
        checkCompatibility(artifact, failures);

        ValidationResult result = new ValidationResult(metrics, failures);
        log.info("🧪 VALIDATE passed={} metrics={} failures={}", result.passed(), metrics, result.details());
        return result;
    }

    // =========================================================
    // gates
    // =========================================================

    void checkImprovement(Map<String, Double> metrics, ModelVersion active, List<GateFailure> out) {
        if (active == null) return;

        for (var e : props.getValidation().getMetrics().entrySet()) {
            String name = e.getKey();
            RetrainingProperties.MetricGate gate = e.getValue();

            Double cand = metrics.get(name);
            Double base = active.metrics().get(name);

            if (cand == null) {
                out.add(new GateFailure(ValidationGate.IMPROVEMENT, name + ": missing in candidate metrics"));
                continue;
            }
            if (base == null) continue;

            double gain = gate.getDirection().gain(cand, base);
            if (gain + EPS < gate.getImprovementThreshold()) {
                out.add(new GateFailure(ValidationGate.IMPROVEMENT, String.format(Locale.ROOT,
                        "%s: gain %.4f < %.4f (candidate %.4f vs active %.4f)",
                        name, gain, gate.getImprovementThreshold(), cand, base)));
            }
        }
    }

    void checkMinimums(Map<String, Double> metrics, List<GateFailure> out) {
        for (var e : props.getValidation().getMetrics().entrySet()) {
            RetrainingProperties.MetricGate gate = e.getValue();
            if (gate.getMinimum() == null) continue;

            Double cand = metrics.get(e.getKey());
            if (cand == null) {
                out.add(new GateFailure(ValidationGate.MINIMUM_REQUIREMENT, e.getKey() + ": missing in candidate metrics"));
            } else if (!gate.getDirection().meets(cand, gate.getMinimum())) {
                out.add(new GateFailure(ValidationGate.MINIMUM_REQUIREMENT, String.format(Locale.ROOT,
                        "%s: %.4f does not meet %s %.4f",
                        e.getKey(), cand,
                        gate.getDirection() == MetricDirection.HIGHER_IS_BETTER ? "minimum" : "maximum",
                        gate.getMinimum())));
            }
        }
    }

    void checkStability(ModelArtifact artifact, DatasetSnapshot holdout, List<GateFailure> out) {
        RetrainingProperties.Validation cfg = props.getValidation();

        if (holdout.isEmpty()) {
            out.add(new GateFailure(ValidationGate.STABILITY, "held-out set is empty"));
            return;
        }

        List<List<Double>> runs = new ArrayList<>();
        try {
            for (int i = 0; i < cfg.getStabilityRuns(); i++) {
                List<Double> p = trainer.predict(artifact, holdout);
                runs.add(p != null ? p : List.of());
            }
        } catch (RuntimeException e) {
            out.add(new GateFailure(ValidationGate.STABILITY, "predict failed: " + e.getMessage()));
            return;
        }

        double rate = agreementRate(runs, holdout.size(), cfg.getStabilityTolerance());
        if (rate + EPS < cfg.getStabilityThreshold()) {
            out.add(new GateFailure(ValidationGate.STABILITY, String.format(Locale.ROOT,
                    "agreement %.4f < %.4f over %d runs", rate, cfg.getStabilityThreshold(), runs.size())));
        }
    }

    void checkCompatibility(ModelArtifact artifact, List<GateFailure> out) {
        String expected = props.getValidation().getExpectedSchemaVersion();
        if (!Objects.equals(expected, artifact.schemaVersion())) {
            out.add(new GateFailure(ValidationGate.COMPATIBILITY,
                    "schema " + artifact.schemaVersion() + " != expected " + expected));
        }
    }

    /**
     * Доля строк, где каждый прогон совпал с первым в пределах tolerance.
     * Прогон другой длины считается несогласным по всем строкам.
     */
    static double agreementRate(List<List<Double>> runs, int rows, double tolerance) {
        if (rows <= 0 || runs.isEmpty()) return 0.0;

        List<Double> first = runs.get(0);
        for (List<Double> r : runs) {
            if (r.size() != rows) return 0.0;
        }

        int agreed = 0;
        for (int i = 0; i < rows; i++) {
            Double ref = first.get(i);
            boolean ok = ref != null && Double.isFinite(ref);
            for (int j = 1; ok && j < runs.size(); j++) {
                Double v = runs.get(j).get(i);
                ok = v != null && Math.abs(v - ref) <= tolerance;
            }
            if (ok) agreed++;
        }
        return (double) agreed / rows;
    }
}
