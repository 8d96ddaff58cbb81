package com.dexsentinel.core.store;

import com.dexsentinel.core.model.CreatureRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Thread-safe {@link RecordStore} keyed by record name.
 *
 * <p>
 * Iteration follows first-insertion order; {@link #scan()} returns a copy
 * taken at call time, so writers never disturb a running scan.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, CreatureRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void upsert(CreatureRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(record.getName(), "record name must not be null");
        CreatureRecord existing = records.get(record.getName());
        if (existing != null && existing.getId() != null
                && !existing.getId().equals(record.getId())) {
            // id is fixed once assigned; name is the key
            record = record.toBuilder().id(existing.getId()).build();
        }
        records.put(record.getName(), record);
    }

    @Override
    public synchronized Iterable<CreatureRecord> scan() {
        return List.copyOf(records.values());
    }

    @Override
    public synchronized long count() {
        return records.size();
    }

    @Override
    public synchronized Optional<CreatureRecord> findByName(String name) {
        return Optional.ofNullable(records.get(name));
    }
}
