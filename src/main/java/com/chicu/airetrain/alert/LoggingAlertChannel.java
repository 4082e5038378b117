package com.chicu.airetrain.alert;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class LoggingAlertChannel implements AlertChannel {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(AlertSeverity severity, String message, Map<String, Object> context) {
        switch (severity) {
            case CRITICAL -> log.error("🚨 ALERT [CRITICAL] {} ctx={}", message, context);
            case WARNING -> log.warn("⚠️ ALERT [WARNING] {} ctx={}", message, context);
            default -> log.info("🔔 ALERT [INFO] {} ctx={}", message, context);
        }
    }
}
