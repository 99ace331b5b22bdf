package io.dhtprobe.analysis;

import io.dhtprobe.model.ProbeRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Lifetime and payload-size distributions over a probe store snapshot.
 *
 * <p>A probe's lifetime is the span from its first to its last evaluation
 * start plus the last evaluation's duration; probes with fewer than two
 * evaluations have no lifetime yet. Lifetimes are binned per hour, payload
 * sizes per 1000 bytes.
 */
public record ProbeLifetimeReport(
        int totalProbes,
        Group successes,
        Group failures,
        Map<String, Integer> failureReasons
) {
    public static final double LIFETIME_BIN_HOURS = 1.0d;
    public static final int PAYLOAD_BIN_BYTES = 1000;

    public static ProbeLifetimeReport from(Collection<ProbeRecord> records) {
        List<ProbeRecord> active = new ArrayList<>();
        List<ProbeRecord> failed = new ArrayList<>();
        Map<String, Integer> reasons = new TreeMap<>();
        for (ProbeRecord record : records) {
            if (record.isActive()) {
                active.add(record);
            } else {
                failed.add(record);
                reasons.merge(reasonCategory(record.failureReason()), 1, Integer::sum);
            }
        }
        return new ProbeLifetimeReport(records.size(), Group.of(active), Group.of(failed), reasons);
    }

    public static OptionalDouble lifetimeSeconds(ProbeRecord record) {
        List<Double> starts = record.evaluationStartUnixtimes();
        List<Double> durations = record.evaluationDurationsS();
        if (starts.size() < 2) {
            return OptionalDouble.empty();
        }
        int last = starts.size() - 1;
        return OptionalDouble.of(starts.get(last) - starts.get(0) + durations.get(last));
    }

    static String reasonCategory(String failureReason) {
        if (failureReason == null || failureReason.isBlank()) {
            return "unknown";
        }
        int colon = failureReason.indexOf(':');
        return colon < 0 ? failureReason.trim() : failureReason.substring(0, colon).trim();
    }

    public record Group(
            int count,
            int withLifetime,
            Map<Integer, Map<Integer, Integer>> lifetimeHoursByInterval,
            Map<Integer, Integer> payloadSizeBins
    ) {
        static Group of(List<ProbeRecord> records) {
            Map<Integer, Map<Integer, Integer>> lifetimes = new TreeMap<>();
            Map<Integer, Integer> payloads = new TreeMap<>();
            int withLifetime = 0;
            for (ProbeRecord record : records) {
                payloads.merge((record.payloadSizeBytes() / PAYLOAD_BIN_BYTES) * PAYLOAD_BIN_BYTES, 1, Integer::sum);
                OptionalDouble lifetime = lifetimeSeconds(record);
                if (lifetime.isEmpty()) {
                    continue;
                }
                withLifetime++;
                int bin = (int) Math.floor(lifetime.getAsDouble() / 3600.0d / LIFETIME_BIN_HOURS);
                lifetimes.computeIfAbsent(record.evaluationIntervalH(), k -> new TreeMap<>())
                        .merge(bin, 1, Integer::sum);
            }
            return new Group(records.size(), withLifetime, lifetimes, payloads);
        }
    }
}
