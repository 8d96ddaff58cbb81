package com.dexsentinel.app;

import com.dexsentinel.core.model.CreatureRecord;
import com.dexsentinel.core.store.RecordStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads catalog records from a JSON array and loads them into a
 * {@link RecordStore}.
 *
 * <p>
 * Malformed entries are logged and skipped, so a single bad record does not
 * stop the import. Records without a name cannot be stored and are skipped
 * too. Missing {@code created_at} / {@code updated_at} timestamps are set to
 * the import time.
 * </p>
 *
 * @since 1.0.0
 */
public class SeedRecordReader {

    private static final Logger LOG = LoggerFactory.getLogger(SeedRecordReader.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public SeedRecordReader(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = JsonSupport.newObjectMapper();
    }

    /**
     * Parse every well-formed record of the array.
     *
     * @param in JSON array of records
     * @return parsed records, in document order
     * @throws IOException if the input is not a JSON array
     */
    public List<CreatureRecord> read(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isArray()) {
            throw new IOException("Seed records must be a JSON array");
        }

        Instant now = clock.instant();
        List<CreatureRecord> records = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            try {
                CreatureRecord record = mapper.treeToValue(node, CreatureRecord.class);
                if (record.getName() == null || record.getName().isBlank()) {
                    LOG.warn("Seed record #{} has no name - skipping", index);
                } else {
                    records.add(withTimestamps(record, now));
                }
            } catch (IOException | IllegalArgumentException e) {
                LOG.warn("Failed to read seed record #{} - skipping: {}", index, e.getMessage());
            }
            index++;
        }
        return records;
    }

    /**
     * Read the file and upsert every record into the store.
     *
     * @return number of records stored
     * @throws IOException if the file cannot be read or is not a JSON array
     */
    public int load(Path file, RecordStore store) throws IOException {
        List<CreatureRecord> records;
        try (InputStream in = Files.newInputStream(file)) {
            records = read(in);
        }
        records.forEach(store::upsert);
        LOG.info("Loaded {} seed record(s) from {}", records.size(), file);
        return records.size();
    }

    private static CreatureRecord withTimestamps(CreatureRecord record, Instant now) {
        if (record.getCreatedAt() != null && record.getUpdatedAt() != null) {
            return record;
        }
        Instant created = record.getCreatedAt() != null ? record.getCreatedAt() : now;
        return record.toBuilder()
                .createdAt(created)
                .updatedAt(record.getUpdatedAt() != null ? record.getUpdatedAt() : created)
                .build();
    }
}
