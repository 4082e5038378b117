package com.chicu.airetrain.alert;

import java.util.Map;

/**
 * Конкретный транспорт (лог, webhook, ...). Может падать: диспетчер это переживёт.
 */
public interface AlertChannel {

    String name();

    void send(AlertSeverity severity, String message, Map<String, Object> context) throws Exception;
}
