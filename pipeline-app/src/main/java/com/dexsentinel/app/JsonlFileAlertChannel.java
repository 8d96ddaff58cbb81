package com.dexsentinel.app;

import com.dexsentinel.core.alert.AlertChannel;
import com.dexsentinel.core.model.Alert;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * {@link AlertChannel} that appends every alert as one JSON line to a daily
 * file {@code alerts_yyyyMMdd.jsonl} (UTC date of the alert) in the alerts
 * directory.
 *
 * @since 1.0.0
 */
public class JsonlFileAlertChannel implements AlertChannel {

    public static final String NAME = "file";

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd")
            .withZone(ZoneOffset.UTC);

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonlFileAlertChannel(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.mapper = JsonSupport.newObjectMapper();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void deliver(Alert alert) throws IOException {
        Files.createDirectories(directory);
        String line = mapper.writeValueAsString(alert);
        try (Writer writer = Files.newBufferedWriter(fileFor(alert), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(line);
            writer.write('\n');
        }
    }

    /**
     * @return the file the given alert is appended to
     */
    Path fileFor(Alert alert) {
        return directory.resolve("alerts_" + DAY.format(alert.getTimestamp()) + ".jsonl");
    }
}
