package com.dexsentinel.app;

import com.dexsentinel.core.model.Reason;
import com.dexsentinel.core.store.InMemoryRecordStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the HTTP surface over a fully wired application on an
 * ephemeral port.
 */
class PipelineHttpServerTest {

    private static final String SEED = "["
            + "{\"id\":25,\"name\":\"pikachu\",\"base_experience\":112,\"types\":[\"electric\"],"
            + "\"stats\":{\"hp\":35,\"attack\":55,\"defense\":40,\"special_attack\":50,"
            + "\"special_defense\":50,\"speed\":90},\"sprite_front\":\"f.png\",\"sprite_shiny\":\"s.png\"}"
            + "]";

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private PipelineApplication app;
    private Path alertsDir;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        Path seed = dir.resolve("seed.json");
        Files.writeString(seed, SEED);
        alertsDir = dir.resolve("alerts");
        AppConfig config = new AppConfig.Builder()
                .httpPort(0)
                .pollIntervalSeconds(0)
                .alertsDir(alertsDir.toString())
                .seedRecordsPath(seed.toString())
                .build();

        app = PipelineApplication.create(config, new InMemoryRecordStore(), Clock.systemUTC());
        app.start(0);
        baseUrl = "http://localhost:" + app.httpServer().port();
    }

    @AfterEach
    void tearDown() {
        app.stop();
    }

    @Test
    @DisplayName("Should report health")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).get("status").asText()).isEqualTo("UP");
    }

    @Test
    @DisplayName("Should answer lifecycle conflicts with 409")
    void shouldAnswerLifecycleConflicts() throws Exception {
        HttpResponse<String> stopWhileStopped = post("/stream/stop");
        assertThat(stopWhileStopped.statusCode()).isEqualTo(200);
        assertThat(json(stopWhileStopped).get("reason").asText()).isEqualTo(Reason.ALREADY_STOPPED.name());

        assertThat(post("/stream/start").statusCode()).isEqualTo(200);

        HttpResponse<String> again = post("/stream/start");
        assertThat(again.statusCode()).isEqualTo(409);
        assertThat(json(again).get("success").asBoolean()).isFalse();
        assertThat(json(again).get("reason").asText()).isEqualTo(Reason.ALREADY_RUNNING.name());

        JsonNode status = json(get("/stream/status"));
        assertThat(status.get("is_running").asBoolean()).isTrue();
        assertThat(status.get("start_time").isNull()).isFalse();
    }

    @Test
    @DisplayName("Should reject simulation while the processor is stopped")
    void shouldRejectSimulationWhileStopped() throws Exception {
        HttpResponse<String> response = post("/stream/simulate?name=pikachu&rule=negative_stats");

        assertThat(response.statusCode()).isEqualTo(409);
        assertThat(json(response).get("reason").asText()).isEqualTo(Reason.NOT_RUNNING.name());
    }

    @Test
    @DisplayName("Should simulate an anomaly and raise a critical alert")
    void shouldSimulateAnomaly() throws Exception {
        post("/stream/start");

        HttpResponse<String> response = post("/stream/simulate?name=pikachu&rule=negative_stats");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode event = json(response).get("data");
        assertThat(event.get("record_name").asText()).isEqualTo("pikachu");
        assertThat(event.get("anomalies_count").asInt()).isEqualTo(1);

        JsonNode critical = json(get("/alerts/history?level=critical"));
        assertThat(critical).hasSize(1);
        assertThat(critical.get(0).get("details").get("rule").asText()).isEqualTo("negative_stats");
        assertThat(json(get("/alerts/history?level=info"))).isEmpty();

        JsonNode status = json(get("/stream/status"));
        assertThat(status.get("processed_count").asLong()).isEqualTo(1);
        assertThat(status.get("alerts_sent").asLong()).isEqualTo(1);

        assertThat(json(get("/stream/events?limit=10"))).hasSize(1);
        try (Stream<Path> files = Files.list(alertsDir)) {
            assertThat(files.filter(f -> f.getFileName().toString().endsWith(".jsonl"))).hasSize(1);
        }
    }

    @Test
    @DisplayName("Should answer unknown rules with 404 and bad input with 400")
    void shouldMapFailures() throws Exception {
        post("/stream/start");

        assertThat(post("/stream/simulate?name=pikachu&rule=nope").statusCode()).isEqualTo(404);
        assertThat(post("/stream/rules?rule=nope&enabled=false").statusCode()).isEqualTo(404);
        assertThat(post("/stream/simulate?rule=negative_stats").statusCode()).isEqualTo(400);
        assertThat(post("/stream/rules?rule=negative_stats&enabled=maybe").statusCode()).isEqualTo(400);
        assertThat(get("/stream/events?limit=abc").statusCode()).isEqualTo(400);
        assertThat(get("/alerts/history?level=bogus").statusCode()).isEqualTo(400);
        assertThat(post("/alerts/test?level=bogus").statusCode()).isEqualTo(400);
        assertThat(post("/alerts/channels?channel=pager&enabled=true").statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("Should distinguish unknown paths from wrong methods")
    void shouldRouteByMethodAndPath() throws Exception {
        assertThat(get("/nowhere").statusCode()).isEqualTo(404);
        assertThat(post("/health").statusCode()).isEqualTo(405);
        assertThat(get("/stream/start").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should disable a rule so simulation no longer finds it")
    void shouldToggleRule() throws Exception {
        post("/stream/start");

        HttpResponse<String> toggled = post("/stream/rules?rule=negative_stats&enabled=false");
        assertThat(toggled.statusCode()).isEqualTo(200);

        JsonNode event = json(post("/stream/simulate?name=pikachu&rule=negative_stats")).get("data");
        assertThat(event.get("anomalies_count").asInt()).isZero();
    }

    @Test
    @DisplayName("Should send, clear and export alerts")
    void shouldManageAlerts() throws Exception {
        assertThat(post("/alerts/test?level=warning").statusCode()).isEqualTo(200);
        assertThat(post("/alerts/send?level=info&title=Import%20done&message=ok").statusCode())
                .isEqualTo(200);

        JsonNode metrics = json(get("/alerts/metrics"));
        assertThat(metrics.get("total_alerts").asInt()).isEqualTo(2);
        assertThat(metrics.get("alerts_by_level").get("WARNING").asInt()).isEqualTo(1);

        JsonNode exported = json(post("/alerts/export"));
        assertThat(Path.of(exported.get("data").get("file").asText())).exists();

        JsonNode cleared = json(post("/alerts/clear"));
        assertThat(cleared.get("data").get("cleared_count").asInt()).isEqualTo(2);
        assertThat(json(get("/alerts/history"))).isEmpty();
    }

    @Test
    @DisplayName("Should serve the dashboard summary")
    void shouldServeDashboard() throws Exception {
        HttpResponse<String> response = get("/dashboard/summary");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode summary = json(response);
        assertThat(summary.get("data_quality").get("total_records").asInt()).isEqualTo(1);
        assertThat(summary.get("data_quality").get("quality_score").asDouble()).isEqualTo(100.0);
        assertThat(summary.get("pokemon_stats").get("by_type").get("electric").asInt()).isEqualTo(1);
        assertThat(summary.get("pokemon_stats").get("by_generation").get("Gen 1").asInt()).isEqualTo(1);
        assertThat(summary.get("processing_stats").get("running").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Should parse and decode query strings")
    void shouldParseQuery() {
        assertThat(PipelineHttpServer.parseQuery("name=mr%20mime&flag&=x&"))
                .containsEntry("name", "mr mime")
                .containsEntry("flag", "")
                .hasSize(3);
        assertThat(PipelineHttpServer.parseQuery(null)).isEmpty();
    }

    @Test
    @DisplayName("Should map every failure reason to an HTTP status")
    void shouldMapReasons() {
        assertThat(Map.of(
                Reason.ALREADY_RUNNING, 409,
                Reason.NOT_RUNNING, 409,
                Reason.UNKNOWN_RULE, 404,
                Reason.INVALID_LEVEL, 400,
                Reason.RATE_LIMITED, 429))
                .allSatisfy((reason, status) -> assertThat(PipelineHttpServer.statusFor(reason)).isEqualTo(status));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return mapper.readTree(response.body());
    }
}
