package io.dhtprobe.runtime;

import io.dhtprobe.config.ProbeConfig;
import io.dhtprobe.config.ProbeSettings;
import io.dhtprobe.model.ProbeRecord;
import io.dhtprobe.network.InMemoryNetworkProbeClient;
import io.dhtprobe.storage.CycleLock;
import io.dhtprobe.storage.FileProbeRecordStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

final class DhtProbeRuntimeTest {
    private static final long NOW = 1_700_000_000L;

    @Test
    void cycleIsSkippedWhileAnotherHoldsTheLock() throws Exception {
        Path root = Files.createTempDirectory("dhtprobe-runtime-lock-");
        try {
            InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient();
            DhtProbeRuntime runtime = runtime(root, network, 3);
            ProbeConfig config = config(root);

            try (CycleLock held = CycleLock.tryAcquire(config.lockFile()).orElseThrow()) {
                CycleOutcome outcome = runtime.runCycle();
                Assertions.assertTrue(outcome.skipped());
                Assertions.assertEquals(0, network.connects.get());
                Assertions.assertFalse(Files.exists(root.resolve("stats.json")));
            }

            CycleOutcome outcome = runtime.runCycle();
            Assertions.assertFalse(outcome.skipped());
            Assertions.assertEquals(3, outcome.created());
            Assertions.assertTrue(Files.exists(root.resolve("stats.json")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statusSummarizesStore() throws Exception {
        Path root = Files.createTempDirectory("dhtprobe-runtime-status-");
        try {
            FileProbeRecordStore store = new FileProbeRecordStore(root.resolve("stats.json"));
            ProbeRecord due = ProbeRecord.activated("VLD0:due", 5, null, 1, NOW - 100.0d, 1.0d);
            ProbeRecord later = ProbeRecord.activated("VLD0:later", 5, null, 24, NOW + 500.0d, 1.0d);
            ProbeRecord laterStill = ProbeRecord.activated("VLD0:later2", 5, null, 24, NOW + 900.0d, 1.0d);
            ProbeRecord dead = ProbeRecord.activated("VLD0:dead", 5, null, 12, NOW - 100.0d, 1.0d)
                    .withFailedEvaluation(NOW - 50.0d, 1.0d, "missing_value");
            store.save(Map.of(
                    due.recordKey(), due,
                    later.recordKey(), later,
                    laterStill.recordKey(), laterStill,
                    dead.recordKey(), dead
            ));

            DhtProbeRuntime.StatusOutcome status = runtime(root, new InMemoryNetworkProbeClient(), 10).status();

            Assertions.assertEquals(4, status.totalProbes());
            Assertions.assertEquals(3, status.activeProbes());
            Assertions.assertEquals(1, status.terminatedProbes());
            Assertions.assertEquals(1, status.dueNow());
            Assertions.assertEquals(NOW + 500.0d, status.nextDueUnixtime());
            Assertions.assertEquals(Map.of(1, 1, 24, 2), status.activeByIntervalH());
            Assertions.assertEquals(10, status.targetPopulation());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void auditTrailRecordsProbeLifecycle() throws Exception {
        Path root = Files.createTempDirectory("dhtprobe-runtime-audit-");
        try {
            ProbeConfig config = ProbeConfig.resolve(
                    root.resolve("stats.json").toString(), null, null, root.resolve("audit.jsonl").toString());
            DhtProbeRuntime runtime = new DhtProbeRuntime(
                    config,
                    settings(2),
                    new InMemoryNetworkProbeClient(),
                    new FileProbeRecordStore(root.resolve("stats.json")),
                    MutableClock.atEpochSecond(NOW),
                    new Random(3L)
            );

            runtime.runCycle();

            List<String> lines = Files.readAllLines(root.resolve("audit.jsonl"), StandardCharsets.UTF_8);
            Assertions.assertEquals(3, lines.size());
            Assertions.assertEquals(2L, lines.stream().filter(l -> l.contains("\"action\":\"probe.created\"")).count());
            Assertions.assertTrue(lines.get(2).contains("\"action\":\"cycle.completed\""));
        } finally {
            deleteRecursively(root);
        }
    }

    private static DhtProbeRuntime runtime(Path root, InMemoryNetworkProbeClient network, int target) {
        return new DhtProbeRuntime(
                config(root),
                settings(target),
                network,
                new FileProbeRecordStore(root.resolve("stats.json")),
                MutableClock.atEpochSecond(NOW),
                new Random(3L)
        );
    }

    private static ProbeConfig config(Path root) {
        return ProbeConfig.resolve(root.resolve("stats.json").toString(), null, null, null);
    }

    private static ProbeSettings settings(int target) {
        ProbeSettings defaults = ProbeSettings.defaults();
        return new ProbeSettings(
                target,
                defaults.evaluationIntervalsH(),
                1,
                256,
                0L,
                3,
                4,
                defaults.apiHost(),
                defaults.apiPort(),
                defaults.apiConnectTimeoutMs(),
                defaults.apiRequestTimeoutMs(),
                defaults.purgeCommand()
        );
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
