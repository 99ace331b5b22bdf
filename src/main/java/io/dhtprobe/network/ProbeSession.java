package io.dhtprobe.network;

import io.dhtprobe.error.TransportException;

import java.util.List;
import java.util.Optional;

/**
 * Record-level operations used by the probe lifecycle. Implementations must be
 * safe for concurrent use by the evaluation and creation tasks of one cycle.
 *
 * <p>Every operation may fail with {@link TransportException}.
 */
public interface ProbeSession extends AutoCloseable {
    void debugPurge(String scope);

    /** Creates a record with {@code subkeyCount} owner subkeys; the record is left open. */
    RecordHandle createRecord(int subkeyCount);

    RecordHandle openRecord(String recordKey);

    void closeRecord(RecordHandle handle);

    void writeSubkey(RecordHandle handle, int subkey, byte[] data);

    /**
     * Reads one subkey.
     *
     * @param forceRefresh bypass the local cache and fetch from the network
     * @return the value, or empty when the network holds no value for the subkey
     */
    Optional<byte[]> readSubkey(RecordHandle handle, int subkey, boolean forceRefresh);

    /** Subkey ranges of the record that have not yet propagated. Empty once settled. */
    List<SubkeyRange> inspectPropagation(RecordHandle handle);

    @Override
    void close();
}
