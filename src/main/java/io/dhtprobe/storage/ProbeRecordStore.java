package io.dhtprobe.storage;

import io.dhtprobe.error.CorruptStoreException;
import io.dhtprobe.error.StoreAccessException;
import io.dhtprobe.model.ProbeRecord;

import java.util.Map;

/**
 * Durable snapshot of all probe records keyed by record key.
 */
public interface ProbeRecordStore {
    /**
     * @return all records, or an empty map when no snapshot exists yet
     * @throws CorruptStoreException when a snapshot exists but cannot be parsed
     * @throws StoreAccessException  when the snapshot cannot be read
     */
    Map<String, ProbeRecord> load();

    /**
     * Replaces the previous snapshot with {@code records} in a single step.
     *
     * @throws StoreAccessException when the snapshot cannot be written
     */
    void save(Map<String, ProbeRecord> records);

    /** Human readable location, for logs. */
    String location();
}
