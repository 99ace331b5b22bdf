package io.dhtprobe.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.dhtprobe.util.Hashing;
import io.dhtprobe.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines trail of probe lifecycle events. Each row carries the
 * hash of the previous row so truncation or edits are detectable.
 *
 * <p>Writes are best-effort: a row that cannot be appended is logged and
 * dropped, and the chain continues from the last row that was written.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);
    private static final AuditLogger DISABLED = new AuditLogger();

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    private AuditLogger() {
        this.auditFile = null;
        this.clock = Clock.systemUTC();
        this.previousHash = "";
    }

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Path parent = auditFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(auditFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public static AuditLogger disabled() {
        return DISABLED;
    }

    public boolean enabled() {
        return auditFile != null;
    }

    public synchronized void log(AuditEvent event) {
        if (auditFile == null) {
            return;
        }
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row).getBytes(StandardCharsets.UTF_8));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            LOG.warn("Failed to write audit row {} for {} to {}", event.action(), event.resource(), auditFile, e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    private String loadLastHash() {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            String last = "";
            for (String line : lines) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, details == null ? Map.of() : details);
        }

        public static AuditEvent probe(String action, String recordKey, String result, Map<String, Object> details) {
            return of(action, "probe/" + recordKey, result, details);
        }
    }
}
