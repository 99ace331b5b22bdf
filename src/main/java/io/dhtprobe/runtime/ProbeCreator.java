package io.dhtprobe.runtime;

import io.dhtprobe.error.ProbeException;
import io.dhtprobe.model.ProbeRecord;
import io.dhtprobe.network.ProbeSession;
import io.dhtprobe.network.RecordHandle;
import io.dhtprobe.observability.AuditLogger;
import io.dhtprobe.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Creates one probe: random payload, single-subkey record, write, settle, close.
 * A failed attempt yields no record.
 */
public final class ProbeCreator {
    private static final Logger LOG = LoggerFactory.getLogger(ProbeCreator.class);
    private static final int SUBKEY_COUNT = 1;

    private final SettleWaiter settleWaiter;
    private final List<Integer> evaluationIntervalsH;
    private final int payloadMinBytes;
    private final int payloadMaxBytes;
    private final Random random;
    private final Clock clock;
    private final AuditLogger auditLogger;

    public ProbeCreator(
            SettleWaiter settleWaiter,
            List<Integer> evaluationIntervalsH,
            int payloadMinBytes,
            int payloadMaxBytes,
            Random random,
            Clock clock,
            AuditLogger auditLogger
    ) {
        if (evaluationIntervalsH == null || evaluationIntervalsH.isEmpty()) {
            throw new IllegalArgumentException("at least one evaluation interval is required");
        }
        if (payloadMinBytes < 1 || payloadMaxBytes < payloadMinBytes) {
            throw new IllegalArgumentException("invalid payload size range: "
                    + payloadMinBytes + ".." + payloadMaxBytes);
        }
        this.settleWaiter = settleWaiter;
        this.evaluationIntervalsH = List.copyOf(evaluationIntervalsH);
        this.payloadMinBytes = payloadMinBytes;
        this.payloadMaxBytes = payloadMaxBytes;
        this.random = random;
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    public Optional<ProbeRecord> create(ProbeSession session) {
        byte[] payload = randomPayload();
        int intervalH = evaluationIntervalsH.get(random.nextInt(evaluationIntervalsH.size()));
        RecordHandle handle = null;
        boolean open = false;
        try {
            handle = session.createRecord(SUBKEY_COUNT);
            open = true;
            session.writeSubkey(handle, EvaluationExecutor.PROBE_SUBKEY, payload);
            double settleS = settleWaiter.awaitSettled(session, handle);
            open = false;
            session.closeRecord(handle);
            double createdAt = Unixtime.now(clock);
            ProbeRecord record = ProbeRecord.activated(
                    handle.recordKey(),
                    payload.length,
                    Hashing.sha256Hex(payload),
                    intervalH,
                    createdAt,
                    settleS
            );
            LOG.info("Probe {} active: payload={}B interval={}h settle={}s",
                    record.recordKey(), payload.length, intervalH, settleS);
            auditLogger.log(AuditLogger.AuditEvent.probe(
                    "probe.created",
                    record.recordKey(),
                    "ok",
                    Map.of(
                            "payload_size_bytes", payload.length,
                            "interval_h", intervalH,
                            "settle_duration_s", settleS
                    )
            ));
            return Optional.of(record);
        } catch (ProbeException e) {
            return dropped(session, handle, open, payload.length, e);
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure creating probe", e);
            return dropped(session, handle, open, payload.length, e);
        }
    }

    private Optional<ProbeRecord> dropped(
            ProbeSession session,
            RecordHandle handle,
            boolean open,
            int payloadSizeBytes,
            RuntimeException failure
    ) {
        if (open) {
            closeAfterFailure(session, handle, failure);
        }
        String recordKey = handle == null ? "-" : handle.recordKey();
        LOG.warn("Probe creation dropped (record {}): {}", recordKey, failure.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_type", failure.getClass().getSimpleName());
        details.put("error", String.valueOf(failure.getMessage()));
        details.put("payload_size_bytes", payloadSizeBytes);
        auditLogger.log(AuditLogger.AuditEvent.probe("probe.creation_failed", recordKey, "dropped", details));
        return Optional.empty();
    }

    byte[] randomPayload() {
        int length = payloadMinBytes + random.nextInt(payloadMaxBytes - payloadMinBytes + 1);
        byte[] payload = new byte[length];
        random.nextBytes(payload);
        return payload;
    }

    private static void closeAfterFailure(ProbeSession session, RecordHandle handle, RuntimeException failure) {
        try {
            session.closeRecord(handle);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            LOG.debug("Closing record {} after failed creation also failed", handle.recordKey(), e);
        }
    }
}
