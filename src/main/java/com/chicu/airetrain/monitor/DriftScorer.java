package com.chicu.airetrain.monitor;

import java.util.List;

/**
 * Подключаемый статистический тест дрейфа одной фичи.
 * Результат нормирован в [0..1], 0 значит распределения совпадают.
 */
public interface DriftScorer {

    String method();

    double score(List<Double> baseline, List<Double> current);
}
