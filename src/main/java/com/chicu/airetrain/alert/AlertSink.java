package com.chicu.airetrain.alert;

import java.util.Map;

/**
 * Куда оркестратор сообщает о событиях жизненного цикла.
 * Реализация не должна бросать исключения наружу.
 */
public interface AlertSink {

    void notify(AlertSeverity severity, String message, Map<String, Object> context);
}
