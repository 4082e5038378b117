package com.chicu.airetrain.error;

/**
 * Координатор не в IDLE: второй старт или откат во время работы.
 */
public class CoordinatorBusyException extends IllegalStateException {

    public CoordinatorBusyException(String message) {
        super(message);
    }
}
