package io.dhtprobe.network;

import io.dhtprobe.error.ConnectionUnavailableException;

/**
 * Entry point to the DHT network layer.
 */
public interface NetworkProbeClient {
    /**
     * Opens a session. Closing the returned session disconnects.
     *
     * @throws ConnectionUnavailableException when the network layer cannot be reached at all
     */
    ProbeSession connect();
}
