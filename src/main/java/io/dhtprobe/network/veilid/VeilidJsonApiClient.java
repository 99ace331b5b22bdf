package io.dhtprobe.network.veilid;

import io.dhtprobe.error.ConnectionUnavailableException;
import io.dhtprobe.error.TransportException;
import io.dhtprobe.network.NetworkProbeClient;
import io.dhtprobe.network.ProbeSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Talks to a local {@code veilid-server} over its newline-delimited JSON API.
 */
public final class VeilidJsonApiClient implements NetworkProbeClient {
    private static final Logger LOG = LoggerFactory.getLogger(VeilidJsonApiClient.class);

    private final String host;
    private final int port;
    private final Duration connectTimeout;
    private final Duration requestTimeout;

    public VeilidJsonApiClient(String host, int port, Duration connectTimeout, Duration requestTimeout) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid veilid api port: " + port);
        }
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host.trim();
        this.port = port;
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ProbeSession connect() {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) Math.max(1L, connectTimeout.toMillis()));
        } catch (IOException e) {
            closeQuietly(socket);
            throw new ConnectionUnavailableException("Unable to connect to veilid-server at " + host + ":" + port, e);
        }
        VeilidJsonApiSession session;
        try {
            session = VeilidJsonApiSession.open(socket, requestTimeout);
        } catch (IOException | TransportException e) {
            closeQuietly(socket);
            throw new ConnectionUnavailableException("veilid-server at " + host + ":" + port
                    + " did not provide a routing context", e);
        }
        LOG.info("Connected to veilid-server at {}:{}", host, port);
        return session;
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Ignoring socket close failure", e);
        }
    }
}
