package io.dhtprobe.error;

/**
 * Any network-layer failure during create/open/read/write/close/inspect.
 */
public class TransportException extends ProbeException {
    private final String kind;

    public TransportException(String message) {
        this(null, message, null);
    }

    public TransportException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public TransportException(String kind, String message, Throwable cause) {
        super(kind == null || kind.isBlank() ? message : kind + ": " + message, cause);
        this.kind = kind == null ? "" : kind;
    }

    /** Error kind reported by the network layer, empty for local I/O failures. */
    public String kind() {
        return kind;
    }
}
