package io.dhtprobe.error;

/**
 * No session could be established with the network layer. Aborts the cycle
 * before the store is touched.
 */
public class ConnectionUnavailableException extends ProbeException {
    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
