package io.dhtprobe.storage;

import io.dhtprobe.error.StoreAccessException;
import io.dhtprobe.model.ProbeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probe store addressed by URL: {@code GET} reads the document, {@code PUT}
 * replaces it. A 404 on read means no snapshot yet.
 */
public final class HttpProbeRecordStore implements ProbeRecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(HttpProbeRecordStore.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final URI uri;
    private final HttpClient http;

    public HttpProbeRecordStore(URI uri) {
        this(uri, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    HttpProbeRecordStore(URI uri, HttpClient http) {
        this.uri = uri;
        this.http = http;
    }

    @Override
    public Map<String, ProbeRecord> load() {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = send(request, "read");
        if (response.statusCode() == 404) {
            LOG.info("No probe store at {}, starting empty", uri);
            return new LinkedHashMap<>();
        }
        if (response.statusCode() / 100 != 2) {
            throw new StoreAccessException("Failed to read probe store: " + uri,
                    new IOException("read failed status=" + response.statusCode()));
        }
        return ProbeRecordCodec.decode(response.body(), uri.toString());
    }

    @Override
    public void save(Map<String, ProbeRecord> records) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(ProbeRecordCodec.encode(records), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(request, "write");
        if (response.statusCode() / 100 != 2) {
            throw new StoreAccessException("Failed to write probe store: " + uri,
                    new IOException("write failed status=" + response.statusCode()));
        }
        LOG.debug("Saved {} probe records to {}", records.size(), uri);
    }

    @Override
    public String location() {
        return uri.toString();
    }

    private HttpResponse<String> send(HttpRequest request, String action) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StoreAccessException("Failed to " + action + " probe store: " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreAccessException("Interrupted during probe store " + action + ": " + uri, e);
        }
    }
}
