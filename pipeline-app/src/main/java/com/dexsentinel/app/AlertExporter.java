package com.dexsentinel.app;

import com.dexsentinel.core.alert.AlertSystem;
import com.dexsentinel.core.model.Alert;
import com.dexsentinel.core.model.AlertMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the retained alert history, with the current metrics, to a JSON file
 * {@code alert_export_yyyyMMdd_HHmmss.json} in the alerts directory.
 *
 * @since 1.0.0
 */
public class AlertExporter {

    private static final Logger LOG = LoggerFactory.getLogger(AlertExporter.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private final AlertSystem alertSystem;
    private final Path directory;
    private final Clock clock;
    private final ObjectMapper mapper;

    public AlertExporter(AlertSystem alertSystem, Path directory, Clock clock) {
        this.alertSystem = Objects.requireNonNull(alertSystem, "alertSystem must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = JsonSupport.newObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Export the history, newest alert first.
     *
     * @return path of the written file
     * @throws IOException if the file cannot be written
     */
    public Path export() throws IOException {
        Instant now = clock.instant();
        AlertMetrics metrics = alertSystem.metrics();
        List<Alert> alerts = alertSystem.history(metrics.getBufferCapacity());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("export_timestamp", now);
        document.put("total_alerts", alerts.size());
        document.put("metrics", metrics);
        document.put("alerts", alerts);

        Files.createDirectories(directory);
        Path file = directory.resolve("alert_export_" + STAMP.format(now) + ".json");
        mapper.writeValue(file.toFile(), document);
        LOG.info("Exported {} alert(s) to {}", alerts.size(), file);
        return file;
    }
}
