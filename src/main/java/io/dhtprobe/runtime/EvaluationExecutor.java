package io.dhtprobe.runtime;

import io.dhtprobe.error.DataIntegrityException;
import io.dhtprobe.error.TransportException;
import io.dhtprobe.model.ProbeRecord;
import io.dhtprobe.network.ProbeSession;
import io.dhtprobe.network.RecordHandle;
import io.dhtprobe.observability.AuditLogger;
import io.dhtprobe.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one read-probe against an active record.
 *
 * <p>{@link #evaluate} converts every network or integrity failure into the
 * terminal state of the returned record; it does not throw for them.
 */
public final class EvaluationExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(EvaluationExecutor.class);
    static final int PROBE_SUBKEY = 0;

    private final Clock clock;
    private final AuditLogger auditLogger;

    public EvaluationExecutor(Clock clock, AuditLogger auditLogger) {
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    public ProbeRecord evaluate(ProbeSession session, ProbeRecord record) {
        if (!record.isActive()) {
            throw new IllegalArgumentException("probe is terminated: " + record.recordKey());
        }
        double start = Unixtime.now(clock);
        String failure = null;
        try {
            byte[] data = readOnce(session, record.recordKey());
            verify(record, data);
        } catch (TransportException e) {
            failure = "transport: " + e.getMessage();
        } catch (DataIntegrityException e) {
            failure = e.reason();
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure evaluating {}", record.recordKey(), e);
            failure = "unexpected: " + e;
        }
        double duration = Math.max(0.0d, Unixtime.now(clock) - start);

        if (failure == null) {
            ProbeRecord updated = record.withSuccessfulEvaluation(start, duration);
            LOG.debug("Probe {} readable after {} evaluations, next at {}",
                    record.recordKey(), updated.evaluationCount(), updated.nextEvaluationUnixtime());
            auditLogger.log(AuditLogger.AuditEvent.probe(
                    "probe.evaluated",
                    record.recordKey(),
                    "ok",
                    details(updated, duration, null)
            ));
            return updated;
        }
        ProbeRecord terminated = record.withFailedEvaluation(start, duration, failure);
        LOG.info("Probe {} terminated after {} evaluations: {}",
                record.recordKey(), terminated.evaluationCount(), failure);
        auditLogger.log(AuditLogger.AuditEvent.probe(
                "probe.terminated",
                record.recordKey(),
                "failed",
                details(terminated, duration, failure)
        ));
        return terminated;
    }

    private static byte[] readOnce(ProbeSession session, String recordKey) {
        RecordHandle handle = session.openRecord(recordKey);
        Optional<byte[]> value;
        try {
            value = session.readSubkey(handle, PROBE_SUBKEY, true);
        } catch (RuntimeException e) {
            try {
                session.closeRecord(handle);
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        session.closeRecord(handle);
        return value.orElseThrow(() -> new DataIntegrityException("missing_value"));
    }

    private static void verify(ProbeRecord record, byte[] data) {
        if (data.length != record.payloadSizeBytes()) {
            throw new DataIntegrityException("payload_size_mismatch: expected="
                    + record.payloadSizeBytes() + " actual=" + data.length);
        }
        String expectedDigest = record.payloadSha256();
        if (expectedDigest != null && !expectedDigest.isBlank()
                && !expectedDigest.equalsIgnoreCase(Hashing.sha256Hex(data))) {
            throw new DataIntegrityException("payload_digest_mismatch");
        }
    }

    private static Map<String, Object> details(ProbeRecord record, double durationS, String failure) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("evaluation_count", record.evaluationCount());
        details.put("duration_s", durationS);
        details.put("interval_h", record.evaluationIntervalH());
        if (failure == null) {
            details.put("next_evaluation_unixtime", record.nextEvaluationUnixtime());
        } else {
            details.put("failure_reason", failure);
        }
        return details;
    }
}
