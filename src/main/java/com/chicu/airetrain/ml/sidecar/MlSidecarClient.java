package com.chicu.airetrain.ml.sidecar;

import com.chicu.airetrain.error.TransientIoException;
import com.chicu.airetrain.ml.sidecar.dto.ActivateRequestDto;
import com.chicu.airetrain.ml.sidecar.dto.ActivateResponseDto;
import com.chicu.airetrain.ml.sidecar.dto.EvaluateRequestDto;
import com.chicu.airetrain.ml.sidecar.dto.EvaluateResponseDto;
import com.chicu.airetrain.ml.sidecar.dto.PredictResponseDto;
import com.chicu.airetrain.ml.sidecar.dto.TrainRequestDto;
import com.chicu.airetrain.ml.sidecar.dto.TrainResponseDto;
import com.chicu.airetrain.ml.sidecar.props.MlSidecarProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

@Slf4j
@Component
@RequiredArgsConstructor
public class MlSidecarClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final MlSidecarProperties props;

    private OkHttpClient clientWithTimeouts(long readTimeoutMs) {
        return baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, readTimeoutMs)))
                .callTimeout(Duration.ZERO)
                .build();
    }

    public TrainResponseDto train(TrainRequestDto req) {
        // на /train ждём не меньше бюджета обучения
        long readTimeout = Math.max(props.getReadTimeoutMs(), req.getTimeBudgetMs());
        return post("/train", req, TrainResponseDto.class, readTimeout);
    }

    public EvaluateResponseDto evaluate(EvaluateRequestDto req) {
        return post("/evaluate", req, EvaluateResponseDto.class, props.getReadTimeoutMs());
    }

    public PredictResponseDto predict(EvaluateRequestDto req) {
        return post("/predict", req, PredictResponseDto.class, props.getReadTimeoutMs());
    }

    public ActivateResponseDto activate(ActivateRequestDto req) {
        return post("/activate", req, ActivateResponseDto.class, props.getReadTimeoutMs());
    }

    public JsonNode health() {
        String url = props.getBaseUrl().replaceAll("/+$", "") + "/health";
        Request req = new Request.Builder().url(url).get().build();

        try (Response resp = clientWithTimeouts(props.getReadTimeoutMs()).newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new IllegalStateException("ML /health HTTP " + resp.code());
            }
            String body = resp.body() != null ? resp.body().string() : "{}";
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TransientIoException("ML /health failed: " + e.getMessage(), e);
        }
    }

    private <T> T post(String path, Object body, Class<T> responseType, long readTimeoutMs) {
        String url = props.getBaseUrl().replaceAll("/+$", "") + path;

        try {
            String json = objectMapper.writeValueAsString(body);

            Request.Builder rb = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON));

            if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
                rb.header("X-API-KEY", props.getApiKey().trim());
            }

            try (Response resp = clientWithTimeouts(readTimeoutMs).newCall(rb.build()).execute()) {

                String respBody = resp.body() != null ? resp.body().string() : "";

                if (resp.code() >= 500) {
                    log.warn("🧠 ML sidecar error: POST {} -> {} body={}", path, resp.code(), shrink(respBody));
                    throw new TransientIoException("ML sidecar HTTP " + resp.code() + ": " + shrink(respBody));
                }
                if (!resp.isSuccessful()) {
                    log.warn("🧠 ML sidecar reject: POST {} -> {} body={}", path, resp.code(), shrink(respBody));
                    throw new IllegalStateException("ML sidecar HTTP " + resp.code() + ": " + shrink(respBody));
                }

                if (respBody.isBlank()) {
                    throw new IllegalStateException("ML sidecar пустой ответ: " + path);
                }

                return objectMapper.readValue(respBody, responseType);
            }

        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ML sidecar bad JSON: " + path + " -> " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TransientIoException("ML sidecar IO error: " + url + " -> " + e.getMessage(), e);
        }
    }

    static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
