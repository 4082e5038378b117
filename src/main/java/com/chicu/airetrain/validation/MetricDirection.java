package com.chicu.airetrain.validation;

public enum MetricDirection {

    HIGHER_IS_BETTER,
    LOWER_IS_BETTER;

    /**
     * Насколько candidate лучше baseline (положительное: лучше) с учётом направления метрики.
     */
    public double gain(double candidate, double baseline) {
        return this == HIGHER_IS_BETTER ? candidate - baseline : baseline - candidate;
    }

    /**
     * value не хуже порога (higher: value >= bound, lower: value <= bound).
     */
    public boolean meets(double value, double bound) {
        return this == HIGHER_IS_BETTER ? value >= bound : value <= bound;
    }
}
