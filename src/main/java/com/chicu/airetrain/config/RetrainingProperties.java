package com.chicu.airetrain.config;

import com.chicu.airetrain.validation.MetricDirection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Единая типизированная конфигурация оркестратора (prefix = airetrain).
 * Проверяется на старте: никаких порогов "по месту" в коде.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "airetrain")
public class RetrainingProperties {

    @Valid
    private Schedule schedule = new Schedule();

    @Valid
    private Monitor monitor = new Monitor();

    @Valid
    private Trigger trigger = new Trigger();

    @Valid
    private Training training = new Training();

    @Valid
    private DataWindow dataWindow = new DataWindow();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Versions versions = new Versions();

    @Valid
    private Resources resources = new Resources();

    @Valid
    private Watchdog watchdog = new Watchdog();

    @Valid
    private Alerts alerts = new Alerts();

    @Valid
    private Http http = new Http();

    @Valid
    private Audit audit = new Audit();

    @Valid
    private Bootstrap bootstrap = new Bootstrap();

    @Data
    public static class Schedule {

        private boolean enabled = true;

        /** scheduleIntervalDays */
        @Min(1)
        private int intervalDays = 7;

        /** Как часто тикают проверки (schedule / performance / drift), сек. */
        @Min(1)
        private long checkIntervalSec = 60;
    }

    @Data
    public static class Monitor {

        /** Метрика, по которой судим о деградации прода. */
        @NotBlank
        private String metric = "accuracy";

        /** Источник сэмплов для проверки деградации. */
        @NotBlank
        private String source = "production";

        @Min(1)
        private int recentWindow = 10;

        @Min(1)
        private int historicalWindow = 10;

        /** performanceDegradationRatio */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double degradationRatio = 0.9;

        /** performanceAbsoluteFloor */
        private double absoluteFloor = 0.6;

        /** driftThreshold */
        @DecimalMin("0.0")
        private double driftThreshold = 0.1;

        /** Скорер для /drift/analyze: mean-shift | ks */
        @NotBlank
        private String driftMethod = "mean-shift";

        /** Скользящее окно хранения сэмплов/отчётов. */
        @Min(10)
        private int maxSamples = 1000;
    }

    @Data
    public static class Trigger {

        /** cooldownPeriod: после терминального статуса триггеры той же причины глушим. */
        @NotNull
        private Duration cooldownPeriod = Duration.ofHours(1);

        /** triggerCooldown: минимальный интервал между принятыми триггерами одной причины. */
        @NotNull
        private Duration triggerCooldown = Duration.ofMinutes(5);
    }

    @Data
    public static class Training {

        /** maxTrainingDuration */
        @NotNull
        private Duration maxTrainingDuration = Duration.ofHours(2);

        @NotNull
        private Duration maxValidationDuration = Duration.ofMinutes(10);

        /** TransientIOError: число попыток и стартовая задержка backoff. */
        @Min(1)
        private int dataRetryAttempts = 3;

        @NotNull
        private Duration dataRetryInitialDelay = Duration.ofSeconds(1);

        /** Ожидание возврата в IDLE перед ручным откатом. */
        @NotNull
        private Duration rollbackWaitTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class DataWindow {

        /** Сколько строк держит in-memory окно. */
        @Min(10)
        private int maxRows = 5000;

        /** Хвост окна, отложенный под held-out / stability. */
        @Min(1)
        private int holdoutRows = 500;

        /** Меньше: обучение не запускаем. */
        @Min(1)
        private int minTrainingRows = 100;

        @AssertTrue(message = "airetrain.data-window.holdout-rows must be less than max-rows")
        public boolean isHoldoutInsideWindow() {
            return holdoutRows < maxRows;
        }
    }

    @Data
    public static class Validation {

        /** improvementThreshold / minimumRequirements по каждой метрике. */
        @Valid
        private Map<String, MetricGate> metrics = defaultMetrics();

        /** stabilityThreshold */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double stabilityThreshold = 0.95;

        @Min(2)
        private int stabilityRuns = 3;

        @DecimalMin("0.0")
        private double stabilityTolerance = 1e-9;

        /** Маркер схемы, который ожидает serving path. */
        @NotBlank
        private String expectedSchemaVersion = "v1";

        @AssertTrue(message = "airetrain.validation.metrics must contain at least one metric")
        public boolean isMetricsConfigured() {
            return metrics != null && !metrics.isEmpty();
        }

        private static Map<String, MetricGate> defaultMetrics() {
            Map<String, MetricGate> m = new LinkedHashMap<>();
            MetricGate accuracy = new MetricGate();
            accuracy.setImprovementThreshold(0.02);
            accuracy.setMinimum(0.75);
            m.put("accuracy", accuracy);
            return m;
        }
    }

    @Data
    public static class MetricGate {

        @NotNull
        private MetricDirection direction = MetricDirection.HIGHER_IS_BETTER;

        @DecimalMin("0.0")
        private double improvementThreshold = 0.01;

        /** Для lower-is-better: потолок. null = гейт по этой метрике не проверяем. */
        private Double minimum;
    }

    @Data
    public static class Versions {

        /** maxVersions */
        @Min(2)
        private int maxVersions = 10;

        /** backupRetentionDays */
        @Min(1)
        private int backupRetentionDays = 30;

        @Min(1)
        private long retentionCheckIntervalSec = 3600;
    }

    @Data
    public static class Resources {

        private boolean enabled = true;

        /** resourceThresholds.cpu: доля загрузки CPU процесса (0..1). */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double cpu = 0.95;

        /** resourceThresholds.mem: доля занятого heap. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double memory = 0.90;

        /** resourceThresholds.disk: доля занятого диска рабочего каталога. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double disk = 0.95;

        @NotNull
        private Duration gracePeriod = Duration.ofSeconds(30);

        @Min(1)
        private long checkIntervalSec = 5;
    }

    @Data
    public static class Watchdog {

        private boolean enabled = true;

        /** Сколько после промоушена следим за продом. */
        @NotNull
        private Duration watchWindow = Duration.ofHours(24);

        /** Падение от провалидированного значения, после которого откатываемся. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double rollbackDropRatio = 0.1;

        @Min(1)
        private int minSamples = 10;
    }

    @Data
    public static class Alerts {

        /** Пусто: webhook-канал выключен, остаётся только лог. */
        private String webhookUrl = "";
    }

    /** Исходящие вызовы: ML sidecar и webhook алертов. */
    @Data
    public static class Http {

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(30);

        /** Sidecar один, webhook один: большой пул не нужен. */
        @Min(1)
        private int maxIdleConnections = 4;

        @NotNull
        private Duration keepAlive = Duration.ofMinutes(2);

        /** Вызовы дольше порога пишутся в WARN. */
        @NotNull
        private Duration slowCallThreshold = Duration.ofSeconds(2);

        @NotBlank
        private String userAgent = "ai-retrain";
    }

    @Data
    public static class Audit {

        /** memory | jpa */
        @NotBlank
        private String persistence = "memory";

        @Min(10)
        private int maxEntries = 1000;
    }

    @Data
    public static class Bootstrap {

        /** Пусто: начальной версии нет, первая появится после обучения. */
        private String artifactLocation = "";

        @NotBlank
        private String schemaVersion = "v1";

        /** Метрики начальной версии: база для гейта улучшения. */
        private Map<String, Double> metrics = new LinkedHashMap<>();
    }

    @AssertTrue(message = "airetrain.monitor.degradation-ratio must be > 0")
    public boolean isDegradationRatioPositive() {
        return monitor != null && monitor.getDegradationRatio() > 0;
    }

    @AssertTrue(message = "airetrain.training.max-training-duration must be positive")
    public boolean isTrainingBudgetPositive() {
        return training != null
                && training.getMaxTrainingDuration() != null
                && !training.getMaxTrainingDuration().isNegative()
                && !training.getMaxTrainingDuration().isZero();
    }
}
