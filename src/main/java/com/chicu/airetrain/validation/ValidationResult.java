package com.chicu.airetrain.validation;

import java.util.List;
import java.util.Map;

/**
 * Итог валидации кандидата. passed == failures.isEmpty().
 */
public record ValidationResult(
        Map<String, Double> metrics,
        List<GateFailure> failures
) {
    public ValidationResult {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ValidationResult failed(ValidationGate gate, String detail) {
        return new ValidationResult(Map.of(), List.of(new GateFailure(gate, detail)));
    }

    public boolean passed() {
        return failures.isEmpty();
    }

    public boolean failedGate(ValidationGate gate) {
        return failures.stream().anyMatch(f -> f.gate() == gate);
    }

    public List<String> details() {
        return failures.stream().map(GateFailure::toString).toList();
    }
}
