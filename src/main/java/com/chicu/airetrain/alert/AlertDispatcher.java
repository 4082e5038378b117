package com.chicu.airetrain.alert;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Рассылает алерт во все каналы. Падение канала логируем и идём дальше:
 * доставка алертов не должна ломать оркестрацию.
 */
@Slf4j
@Service
public class AlertDispatcher implements AlertSink {

    private final List<AlertChannel> channels;

    public AlertDispatcher(List<AlertChannel> channels) {
        this.channels = List.copyOf(channels);
        log.info("🔔 AlertDispatcher поднят. Каналов: {}", this.channels.size());
    }

    @Override
    public void notify(AlertSeverity severity, String message, Map<String, Object> context) {
        AlertSeverity sev = severity != null ? severity : AlertSeverity.INFO;
        Map<String, Object> ctx = context != null ? context : Map.of();

        for (AlertChannel ch : channels) {
            try {
                ch.send(sev, message, ctx);
            } catch (Exception e) {
                log.warn("🔔 ALERT channel '{}' failed: {} (alert='{}')", ch.name(), e.getMessage(), message);
            }
        }
    }
}
