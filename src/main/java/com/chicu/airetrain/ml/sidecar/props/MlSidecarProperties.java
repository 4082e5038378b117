package com.chicu.airetrain.ml.sidecar.props;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.sidecar")
public class MlSidecarProperties {

    /**
     * Пример: http://127.0.0.1:8001
     */
    private String baseUrl = "http://127.0.0.1:8001";

    /**
     * Защита sidecar (если включена в python).
     */
    private String apiKey = "";

    /** Ключ модели, под которым sidecar хранит артефакты. */
    private String modelKey = "default";

    private long connectTimeoutMs = 1000;

    /**
     * read-timeout для /evaluate, /predict, /activate.
     * Для /train берём бюджет обучения: он больше.
     */
    private long readTimeoutMs = 8000;
}
