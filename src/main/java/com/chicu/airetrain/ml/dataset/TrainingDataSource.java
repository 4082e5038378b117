package com.chicu.airetrain.ml.dataset;

/**
 * Внешний источник данных. Возвращает неизменяемые снапшоты.
 * Временная недоступность: {@link com.chicu.airetrain.error.TransientIoException}.
 */
public interface TrainingDataSource {

    DatasetSnapshot trainingWindow();

    DatasetSnapshot holdoutWindow();
}
