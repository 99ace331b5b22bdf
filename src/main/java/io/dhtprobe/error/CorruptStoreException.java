package io.dhtprobe.error;

/**
 * Persisted probe state exists but cannot be parsed. Fatal for the process.
 */
public class CorruptStoreException extends ProbeException {
    public CorruptStoreException(String message) {
        super(message);
    }

    public CorruptStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
