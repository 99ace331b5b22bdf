package io.dhtprobe.error;

/**
 * A read succeeded but the returned value does not match what was written.
 */
public class DataIntegrityException extends ProbeException {
    private final String reason;

    public DataIntegrityException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
