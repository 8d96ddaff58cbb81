package com.dexsentinel.core.store;

import com.dexsentinel.core.model.CreatureRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds the canonical creature records.
 *
 * <p>
 * The core only reads from the store: {@link #scan()} for the dashboard and
 * the poller, {@link #findByName(String)} for anomaly simulation. Writes come
 * from the catalog import side. Implementations signal an unreachable backend
 * with {@link StoreUnavailableException}; the core never retries.
 * </p>
 *
 * @since 1.0.0
 */
public interface RecordStore {

    /**
     * Insert the record, or replace the record with the same name. An id
     * already assigned to that name is kept.
     *
     * @param record the record; must have a name
     */
    void upsert(CreatureRecord record);

    /**
     * Return a finite view of all records. Each call to
     * {@link Iterable#iterator()} starts a fresh pass.
     *
     * @return all records
     * @throws StoreUnavailableException if the backend cannot be read
     */
    Iterable<CreatureRecord> scan();

    /**
     * @return number of stored records
     * @throws StoreUnavailableException if the backend cannot be read
     */
    long count();

    /**
     * Look up a record by its natural key. The default implementation scans.
     *
     * @param name record name
     * @return the record, or empty if absent
     */
    default Optional<CreatureRecord> findByName(String name) {
        for (CreatureRecord record : scan()) {
            if (Objects.equals(record.getName(), name)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }
}
