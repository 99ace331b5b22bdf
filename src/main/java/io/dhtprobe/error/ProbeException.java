package io.dhtprobe.error;

/**
 * Base type for failures raised by the probe runtime.
 */
public class ProbeException extends RuntimeException {
    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
