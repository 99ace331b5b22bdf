package io.dhtprobe.network.veilid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dhtprobe.error.TransportException;
import io.dhtprobe.network.ProbeSession;
import io.dhtprobe.network.RecordHandle;
import io.dhtprobe.network.SubkeyRange;
import io.dhtprobe.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One connection to the veilid JSON API bound to a single routing context.
 *
 * <p>Requests are correlated with responses by {@code id}, so tasks of one
 * cycle can share the session. Asynchronous {@code Update} messages are dropped.
 */
final class VeilidJsonApiSession implements ProbeSession {
    private static final Logger LOG = LoggerFactory.getLogger(VeilidJsonApiSession.class);
    private static final Base64.Encoder B64_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder B64_DECODER = Base64.getUrlDecoder();

    private final Socket socket;
    private final BufferedWriter writer;
    private final BufferedReader reader;
    private final Duration requestTimeout;
    private final AtomicLong nextRequestId;
    private final ConcurrentMap<Long, CompletableFuture<JsonNode>> pending;
    private final AtomicBoolean closed;
    private final Thread readerThread;
    private long routingContextId;

    private VeilidJsonApiSession(Socket socket, Duration requestTimeout) throws IOException {
        this.socket = socket;
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.requestTimeout = requestTimeout;
        this.nextRequestId = new AtomicLong(1L);
        this.pending = new ConcurrentHashMap<>();
        this.closed = new AtomicBoolean(false);
        this.readerThread = new Thread(this::readLoop, "veilid-json-reader");
        this.readerThread.setDaemon(true);
    }

    static VeilidJsonApiSession open(Socket socket, Duration requestTimeout) throws IOException {
        VeilidJsonApiSession session = new VeilidJsonApiSession(socket, requestTimeout);
        session.readerThread.start();
        try {
            ObjectNode request = Jsons.compactMapper().createObjectNode();
            request.put("op", "NewRoutingContext");
            JsonNode response = session.call(request);
            session.routingContextId = response.path("value").asLong();
        } catch (TransportException e) {
            session.shutdown();
            throw e;
        }
        return session;
    }

    @Override
    public void debugPurge(String scope) {
        ObjectNode request = Jsons.compactMapper().createObjectNode();
        request.put("op", "Debug");
        request.put("command", scope);
        JsonNode response = call(request);
        LOG.debug("debug '{}' -> {}", scope, response.path("value").asText(""));
    }

    @Override
    public RecordHandle createRecord(int subkeyCount) {
        ObjectNode request = routingContextRequest("CreateDhtRecord");
        ObjectNode schema = request.putObject("schema");
        schema.put("kind", "DFLT");
        schema.put("o_cnt", subkeyCount);
        request.putNull("kind");
        JsonNode descriptor = call(request).path("value");
        String key = descriptor.path("key").asText("");
        if (key.isBlank()) {
            throw new TransportException("InvalidResponse", "CreateDhtRecord returned no key", null);
        }
        String owner = descriptor.path("owner").asText("");
        String ownerSecret = descriptor.path("owner_secret").asText("");
        String writerKeyPair = owner.isBlank() || ownerSecret.isBlank() ? null : owner + ":" + ownerSecret;
        return new RecordHandle(key, writerKeyPair);
    }

    @Override
    public RecordHandle openRecord(String recordKey) {
        ObjectNode request = routingContextRequest("OpenDhtRecord");
        request.put("key", recordKey);
        request.putNull("writer");
        call(request);
        return RecordHandle.readOnly(recordKey);
    }

    @Override
    public void closeRecord(RecordHandle handle) {
        ObjectNode request = routingContextRequest("CloseDhtRecord");
        request.put("key", handle.recordKey());
        call(request);
    }

    @Override
    public void writeSubkey(RecordHandle handle, int subkey, byte[] data) {
        ObjectNode request = routingContextRequest("SetDhtValue");
        request.put("key", handle.recordKey());
        request.put("subkey", subkey);
        request.put("data", B64_ENCODER.encodeToString(data));
        if (handle.writer() != null) {
            request.put("writer", handle.writer());
        }
        call(request);
    }

    @Override
    public Optional<byte[]> readSubkey(RecordHandle handle, int subkey, boolean forceRefresh) {
        ObjectNode request = routingContextRequest("GetDhtValue");
        request.put("key", handle.recordKey());
        request.put("subkey", subkey);
        request.put("force_refresh", forceRefresh);
        JsonNode value = call(request).path("value");
        if (value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        JsonNode data = value.path("data");
        if (!data.isTextual()) {
            return Optional.empty();
        }
        try {
            return Optional.of(B64_DECODER.decode(data.asText()));
        } catch (IllegalArgumentException e) {
            throw new TransportException("InvalidResponse", "GetDhtValue returned undecodable data", e);
        }
    }

    @Override
    public List<SubkeyRange> inspectPropagation(RecordHandle handle) {
        ObjectNode request = routingContextRequest("InspectDhtRecord");
        request.put("key", handle.recordKey());
        request.putArray("subkeys");
        request.put("scope", "Local");
        JsonNode offline = call(request).path("value").path("offline_subkeys");
        List<SubkeyRange> out = new ArrayList<>();
        if (offline.isArray()) {
            for (JsonNode range : offline) {
                if (range.isArray() && range.size() == 2) {
                    out.add(new SubkeyRange(range.get(0).asLong(), range.get(1).asLong()));
                }
            }
        }
        return out;
    }

    @Override
    public void close() {
        if (closed.get()) {
            return;
        }
        try {
            call(routingContextRequest("Release"));
        } catch (TransportException e) {
            LOG.debug("Routing context release failed", e);
        }
        shutdown();
        LOG.info("Disconnected from veilid-server");
    }

    private ObjectNode routingContextRequest(String rcOp) {
        ObjectNode request = Jsons.compactMapper().createObjectNode();
        request.put("op", "RoutingContext");
        request.put("rc_id", routingContextId);
        request.put("rc_op", rcOp);
        return request;
    }

    JsonNode call(ObjectNode request) {
        if (closed.get()) {
            throw new TransportException("NotInitialized", "session is closed", null);
        }
        long id = nextRequestId.getAndIncrement();
        request.put("id", id);
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pending.put(id, future);
        if (closed.get()) {
            pending.remove(id);
            throw new TransportException("NotInitialized", "session is closed", null);
        }
        String label = describe(request);
        try {
            String line = Jsons.compactMapper().writeValueAsString(request);
            synchronized (writer) {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            }
            JsonNode response = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            JsonNode error = response.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                throw new TransportException(
                        error.path("kind").asText("Generic"),
                        label + " failed: " + error.path("message").asText(error.toString()),
                        null
                );
            }
            return response;
        } catch (IOException e) {
            throw new TransportException(label + " could not be sent", e);
        } catch (TimeoutException e) {
            throw new TransportException("Timeout", label + " timed out after " + requestTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(label + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportException transport) {
                throw transport;
            }
            throw new TransportException(label + " failed", cause);
        } finally {
            pending.remove(id);
        }
    }

    private void readLoop() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode message;
                try {
                    message = Jsons.compactMapper().readTree(line);
                } catch (IOException e) {
                    LOG.warn("Dropping unparseable veilid api message: {}", e.getMessage());
                    continue;
                }
                if ("Update".equals(message.path("type").asText("")) || !message.has("id")) {
                    continue;
                }
                CompletableFuture<JsonNode> future = pending.get(message.path("id").asLong());
                if (future != null) {
                    future.complete(message);
                }
            }
            failPending(new TransportException("Disconnected", "veilid-server closed the connection", null));
        } catch (IOException e) {
            failPending(new TransportException("Disconnected", "veilid api connection lost", e));
        }
    }

    private void failPending(TransportException failure) {
        closed.set(true);
        for (CompletableFuture<JsonNode> future : pending.values()) {
            future.completeExceptionally(failure);
        }
    }

    private void shutdown() {
        closed.set(true);
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Ignoring socket close failure", e);
        }
        readerThread.interrupt();
    }

    private static String describe(ObjectNode request) {
        String op = request.path("op").asText("");
        String rcOp = request.path("rc_op").asText("");
        String key = request.path("key").asText("");
        StringBuilder sb = new StringBuilder(rcOp.isEmpty() ? op : rcOp);
        if (!key.isEmpty()) {
            sb.append('(').append(key).append(')');
        }
        return sb.toString();
    }
}
