package io.dhtprobe.error;

/**
 * The probe store could not be read or written (I/O, HTTP status).
 */
public class StoreAccessException extends ProbeException {
    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
