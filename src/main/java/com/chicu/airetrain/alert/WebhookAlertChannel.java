package com.chicu.airetrain.alert;

import com.chicu.airetrain.config.RetrainingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON POST на airetrain.alerts.webhook-url.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnExpression("!'${airetrain.alerts.webhook-url:}'.isBlank()")
public class WebhookAlertChannel implements AlertChannel {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final RetrainingProperties props;
    private final Clock clock;

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void send(AlertSeverity severity, String message, Map<String, Object> context) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("severity", severity.name());
        payload.put("message", message);
        payload.put("context", context);
        payload.put("timestamp", clock.instant().toString());

        Request req = new Request.Builder()
                .url(props.getAlerts().getWebhookUrl())
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();

        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new IOException("webhook HTTP " + resp.code());
            }
        }
    }
}
