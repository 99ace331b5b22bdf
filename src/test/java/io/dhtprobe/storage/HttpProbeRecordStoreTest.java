package io.dhtprobe.storage;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.dhtprobe.error.CorruptStoreException;
import io.dhtprobe.error.StoreAccessException;
import io.dhtprobe.model.ProbeRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

final class HttpProbeRecordStoreTest {
    private HttpServer server;
    private final AtomicReference<String> document = new AtomicReference<>();
    private final AtomicInteger forcedStatus = new AtomicInteger();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/stats.json", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void absentDocumentLoadsAsEmptyStore() {
        Assertions.assertTrue(store().load().isEmpty());
    }

    @Test
    void putThenGetRoundTrips() {
        HttpProbeRecordStore store = store();
        ProbeRecord record = ProbeRecord.activated("VLD0:remote", 42, "ff", 168, 1_700_000_000.0d, 4.0d);

        store.save(Map.of(record.recordKey(), record));

        Assertions.assertEquals("application/json", lastContentType.get());
        Assertions.assertTrue(document.get().contains("\"payload_size_bytes\" : 42"), document.get());
        Assertions.assertEquals(record, store.load().get("VLD0:remote"));
    }

    @Test
    void serverErrorIsStoreAccessFailure() {
        forcedStatus.set(500);
        HttpProbeRecordStore store = store();

        Assertions.assertThrows(StoreAccessException.class, store::load);
        Assertions.assertThrows(StoreAccessException.class, () -> store.save(Map.of()));
    }

    @Test
    void garbageDocumentIsCorrupt() {
        document.set("<html>not json</html>");
        Assertions.assertThrows(CorruptStoreException.class, () -> store().load());
    }

    @Test
    void unreachableServerIsStoreAccessFailure() {
        int port = server.getAddress().getPort();
        server.stop(0);
        HttpProbeRecordStore store = new HttpProbeRecordStore(URI.create("http://127.0.0.1:" + port + "/stats.json"));

        Assertions.assertThrows(StoreAccessException.class, store::load);
    }

    private HttpProbeRecordStore store() {
        return new HttpProbeRecordStore(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/stats.json"));
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            int forced = forcedStatus.get();
            if (forced != 0) {
                exchange.sendResponseHeaders(forced, -1);
                return;
            }
            if ("PUT".equals(exchange.getRequestMethod())) {
                lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
                document.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                exchange.sendResponseHeaders(204, -1);
                return;
            }
            String body = document.get();
            if (body == null) {
                exchange.sendResponseHeaders(404, -1);
                return;
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        } finally {
            exchange.close();
        }
    }
}
