package com.dexsentinel.app;

import com.dexsentinel.core.model.Alert;
import com.dexsentinel.core.model.AlertLevel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonlFileAlertChannel}.
 */
class JsonlFileAlertChannelTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should append one JSON line per alert to the daily file")
    void shouldAppendLines() throws Exception {
        JsonlFileAlertChannel channel = new JsonlFileAlertChannel(dir.resolve("alerts"));

        channel.deliver(alert(1, "2024-05-01T23:59:59Z"));
        channel.deliver(alert(2, "2024-05-01T08:00:00Z"));
        channel.deliver(alert(3, "2024-05-02T00:00:01Z"));

        Path first = dir.resolve("alerts").resolve("alerts_20240501.jsonl");
        List<String> lines = Files.readAllLines(first);
        assertThat(lines).hasSize(2);
        assertThat(Files.readAllLines(dir.resolve("alerts").resolve("alerts_20240502.jsonl"))).hasSize(1);

        JsonNode json = new ObjectMapper().readTree(lines.get(0));
        assertThat(json.get("id").asLong()).isEqualTo(1);
        assertThat(json.get("level").asText()).isEqualTo("CRITICAL");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-01T23:59:59Z");
        assertThat(json.get("details").get("record_name").asText()).isEqualTo("pikachu");
    }

    @Test
    @DisplayName("Should be named file")
    void shouldBeNamedFile() {
        assertThat(new JsonlFileAlertChannel(dir).name()).isEqualTo("file");
    }

    private static Alert alert(long id, String timestamp) {
        return Alert.builder()
                .id(id)
                .timestamp(Instant.parse(timestamp))
                .level(AlertLevel.CRITICAL)
                .title("Anomaly negative_stats in pikachu")
                .message("Record #25 (pikachu): Negative stats detected: hp=-10")
                .details(Map.of("record_name", "pikachu"))
                .build();
    }
}
