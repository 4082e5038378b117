package com.chicu.airetrain.ml.sidecar;

import com.chicu.airetrain.error.TrainingException;
import com.chicu.airetrain.error.TransientIoException;
import com.chicu.airetrain.ml.ModelArtifact;
import com.chicu.airetrain.ml.dataset.DatasetSnapshot;
import com.chicu.airetrain.ml.sidecar.dto.ActivateRequestDto;
import com.chicu.airetrain.ml.sidecar.props.MlSidecarProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MlSidecarClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private MockWebServer server;
    private MlSidecarProperties props;
    private MlSidecarClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        props = new MlSidecarProperties();
        props.setBaseUrl(server.url("/").toString());
        props.setApiKey("secret");
        props.setModelKey("churn");
        props.setReadTimeoutMs(2000);

        client = new MlSidecarClient(new OkHttpClient(), mapper, props);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void train_postsMatrixAndMapsArtifact() throws Exception {
        server.enqueue(json("{\"ok\":true,\"modelPath\":\"/models/churn/7.bin\",\"modelVersion\":\"7\",\"schemaVersion\":\"v1\"}"));
        SidecarModelTrainer trainer = new SidecarModelTrainer(client, props);

        ModelArtifact artifact = trainer.train(dataset(), Duration.ofMinutes(5));

        assertEquals("/models/churn/7.bin", artifact.location());
        assertEquals("v1", artifact.schemaVersion());
        assertEquals("7", artifact.meta().get("sidecarVersion"));

        RecordedRequest rec = server.takeRequest();
        assertEquals("/train", rec.getPath());
        assertEquals("secret", rec.getHeader("X-API-KEY"));
        JsonNode body = mapper.readTree(rec.getBody().readUtf8());
        assertEquals("churn", body.get("modelKey").asText());
        assertEquals(2, body.get("X").size());
        assertEquals(300_000, body.get("timeBudgetMs").asLong());
        assertFalse(body.has("x"));
    }

    @Test
    void train_notOk_isTrainingError() {
        server.enqueue(json("{\"ok\":false,\"message\":\"labels constant\"}"));
        SidecarModelTrainer trainer = new SidecarModelTrainer(client, props);

        TrainingException ex = assertThrows(TrainingException.class, () -> trainer.train(dataset(), Duration.ofMinutes(1)));
        assertTrue(ex.getMessage().contains("labels constant"));
    }

    @Test
    void evaluate_returnsMetrics() {
        server.enqueue(json("{\"ok\":true,\"metrics\":{\"accuracy\":0.83,\"f1\":0.71}}"));
        SidecarModelTrainer trainer = new SidecarModelTrainer(client, props);

        Map<String, Double> metrics = trainer.evaluate(artifact(), dataset());

        assertEquals(0.83, metrics.get("accuracy"));
        assertEquals(0.71, metrics.get("f1"));
    }

    @Test
    void predict_sendsNoLabels() throws Exception {
        server.enqueue(json("{\"ok\":true,\"predictions\":[1.0,0.0]}"));
        SidecarModelTrainer trainer = new SidecarModelTrainer(client, props);

        assertEquals(List.of(1.0, 0.0), trainer.predict(artifact(), dataset()));

        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertTrue(body.get("y") == null || body.get("y").isNull());
    }

    @Test
    void serverError_isTransient() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("warming up"));

        TransientIoException ex = assertThrows(TransientIoException.class,
                () -> client.activate(ActivateRequestDto.builder().modelKey("churn").modelPath("/m").versionId(3).build()));
        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    void clientError_isNotTransient() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"detail\":\"bad X\"}"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> client.activate(ActivateRequestDto.builder().modelKey("churn").modelPath("/m").versionId(3).build()));
        assertEquals(IllegalStateException.class, ex.getClass());
        assertTrue(ex.getMessage().contains("400"));
    }

    @Test
    void activator_rejectsNotOk() {
        server.enqueue(json("{\"ok\":false,\"message\":\"file missing\"}"));
        SidecarArtifactActivator activator = new SidecarArtifactActivator(client, props);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> activator.activate(4, artifact()));
        assertTrue(ex.getMessage().contains("file missing"));
    }

    @Test
    void health_readsJson() {
        server.enqueue(json("{\"status\":\"ok\"}"));

        assertEquals("ok", client.health().get("status").asText());
    }

    @Test
    void unreachableSidecar_isTransient() throws IOException {
        server.shutdown();

        assertThrows(TransientIoException.class, () -> client.health());
    }

    @Test
    void shrink_collapsesWhitespaceAndTruncates() {
        assertEquals("a b c", MlSidecarClient.shrink("  a\n b\t\tc "));
        assertEquals(403, MlSidecarClient.shrink("x".repeat(1000)).length());
        assertEquals("null", MlSidecarClient.shrink(null));
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private static ModelArtifact artifact() {
        return ModelArtifact.builder().location("/models/churn/6.bin").schemaVersion("v1").build();
    }

    private static DatasetSnapshot dataset() {
        return DatasetSnapshot.builder()
                .datasetId("train-1")
                .featureNames(List.of("tenure", "spend"))
                .rows(List.of(List.of(1.0, 20.0), List.of(12.0, 5.0)))
                .labels(List.of(1.0, 0.0))
                .takenAt(Instant.EPOCH)
                .build();
    }
}
