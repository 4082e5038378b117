package com.chicu.airetrain.error;

/**
 * Таксономия ошибок оркестратора.
 * Каждый вид однозначно маппится на переход state machine координатора.
 */
public enum FailureKind {

    /** источник данных временно недоступен: ретраим на месте */
    TRANSIENT_IO,

    /** тренер упал / вернул мусор */
    TRAINING_ERROR,

    /** обучение дольше maxTrainingDuration */
    TRAINING_TIMEOUT,

    /** Resource Guard снял обучение */
    RESOURCE_EXCEEDED,

    /** кандидат не прошёл гейты */
    VALIDATION_FAILURE,

    /** атомарная замена Active не завершилась */
    PROMOTION_FAILURE,

    /** целевая версия уже вытеснена / неизвестна */
    ROLLBACK_FAILURE,

    /** запрос снят оператором (ручной rollback) или вытеснен более приоритетным */
    ABORTED
}
