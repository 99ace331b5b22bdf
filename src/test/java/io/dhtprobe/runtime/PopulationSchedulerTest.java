package io.dhtprobe.runtime;

import io.dhtprobe.error.ConnectionUnavailableException;
import io.dhtprobe.error.CorruptStoreException;
import io.dhtprobe.model.ProbeRecord;
import io.dhtprobe.network.InMemoryNetworkProbeClient;
import io.dhtprobe.observability.AuditLogger;
import io.dhtprobe.storage.ProbeRecordStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

final class PopulationSchedulerTest {
    private static final long NOW = 1_700_000_000L;
    private static final List<Integer> INTERVALS = List.of(1, 12, 24, 168, 672);

    private final MutableClock clock = MutableClock.atEpochSecond(NOW);

    @Test
    void emptyStoreIsFilledToTargetPopulation() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient();
        MemoryStore store = new MemoryStore();

        CycleOutcome outcome = scheduler(network, store, 100).runCycle();

        Map<String, ProbeRecord> saved = store.snapshot();
        Assertions.assertEquals(100, saved.size());
        Assertions.assertEquals(100, outcome.created());
        Assertions.assertEquals(100, outcome.activeAfter());
        Assertions.assertEquals(0, outcome.creationFailures());
        Set<String> keys = new HashSet<>();
        for (ProbeRecord record : saved.values()) {
            Assertions.assertTrue(keys.add(record.recordKey()));
            Assertions.assertTrue(record.isActive());
            Assertions.assertTrue(INTERVALS.contains(record.evaluationIntervalH()));
            Assertions.assertTrue(record.evaluationStartUnixtimes().isEmpty());
        }
        Assertions.assertEquals(1, store.saves.get());
        Assertions.assertEquals(1, network.purges.get());
        Assertions.assertEquals(1, network.disconnects.get());
        Assertions.assertTrue(network.openRecords().isEmpty());
    }

    @Test
    void onlyDueProbesAreEvaluated() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient()
                .put("VLD0:due", new byte[500])
                .put("VLD0:later", new byte[40]);
        ProbeRecord due = EvaluationExecutorTest.activeRecord("VLD0:due", 500, 1, NOW - 10.0d);
        ProbeRecord later = EvaluationExecutorTest.activeRecord("VLD0:later", 40, 24, NOW + 100.0d);
        ProbeRecord dead = EvaluationExecutorTest.activeRecord("VLD0:dead", 7, 12, NOW - 50.0d)
                .withFailedEvaluation(NOW - 50.0d, 0.2d, "missing_value");
        MemoryStore store = new MemoryStore(due, later, dead);

        CycleOutcome outcome = scheduler(network, store, 3).runCycle();

        Map<String, ProbeRecord> saved = store.snapshot();
        Assertions.assertEquals(1, outcome.due());
        Assertions.assertEquals(1, outcome.evaluatedOk());
        Assertions.assertEquals(NOW - 10.0d + 3600.0d, saved.get("VLD0:due").nextEvaluationUnixtime());
        Assertions.assertEquals(1, saved.get("VLD0:due").evaluationCount());
        Assertions.assertEquals(later, saved.get("VLD0:later"));
        Assertions.assertEquals(dead, saved.get("VLD0:dead"));
        Assertions.assertEquals(1, outcome.deficit());
        Assertions.assertEquals(4, saved.size());
        Assertions.assertEquals(3, outcome.activeAfter());
        Assertions.assertEquals(1, network.reads.get());
    }

    @Test
    void probeDueExactlyNowWaitsForNextCycle() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient().put("VLD0:edge", new byte[5]);
        MemoryStore store = new MemoryStore(EvaluationExecutorTest.activeRecord("VLD0:edge", 5, 1, NOW));

        CycleOutcome outcome = scheduler(network, store, 1).runCycle();

        Assertions.assertEquals(0, outcome.due());
        Assertions.assertEquals(0, network.reads.get());
    }

    @Test
    void failedEvaluationIsReplacedWithinTheSameCycle() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient()
                .put("VLD0:flaky", new byte[10])
                .failReads("VLD0:flaky");
        MemoryStore store = new MemoryStore(EvaluationExecutorTest.activeRecord("VLD0:flaky", 10, 1, NOW - 1.0d));

        CycleOutcome outcome = scheduler(network, store, 1).runCycle();

        Map<String, ProbeRecord> saved = store.snapshot();
        Assertions.assertEquals(1, outcome.evaluationFailures());
        Assertions.assertEquals(1, outcome.deficit());
        Assertions.assertEquals(1, outcome.created());
        Assertions.assertEquals(2, saved.size());
        Assertions.assertNull(saved.get("VLD0:flaky").nextEvaluationUnixtime());
        Assertions.assertEquals(1, outcome.activeAfter());
    }

    @Test
    void failedCreationsAreDroppedWithoutAbortingCycle() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient().failNextCreates(3);
        MemoryStore store = new MemoryStore();

        CycleOutcome outcome = scheduler(network, store, 10).runCycle();

        Assertions.assertEquals(10, outcome.deficit());
        Assertions.assertEquals(7, outcome.created());
        Assertions.assertEquals(3, outcome.creationFailures());
        Assertions.assertEquals(7, store.snapshot().size());
        Assertions.assertEquals(1, store.saves.get());
    }

    @Test
    void populationAtTargetCreatesNothing() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient();
        MemoryStore store = new MemoryStore(
                EvaluationExecutorTest.activeRecord("VLD0:a", 5, 24, NOW + 10.0d),
                EvaluationExecutorTest.activeRecord("VLD0:b", 5, 24, NOW + 20.0d)
        );

        CycleOutcome outcome = scheduler(network, store, 2).runCycle();

        Assertions.assertEquals(0, outcome.deficit());
        Assertions.assertEquals(0, network.creates.get());
        Assertions.assertEquals(2, store.snapshot().size());
    }

    @Test
    void unreachableNetworkAbortsBeforeTouchingStore() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient().unreachable();
        MemoryStore store = new MemoryStore();

        Assertions.assertThrows(ConnectionUnavailableException.class, () -> scheduler(network, store, 5).runCycle());

        Assertions.assertEquals(0, store.loads.get());
        Assertions.assertEquals(0, store.saves.get());
    }

    @Test
    void corruptStoreAbortsWithoutSaving() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient();
        MemoryStore store = new MemoryStore();
        store.corrupt = true;

        Assertions.assertThrows(CorruptStoreException.class, () -> scheduler(network, store, 5).runCycle());

        Assertions.assertEquals(0, store.saves.get());
        Assertions.assertEquals(0, network.creates.get());
        Assertions.assertEquals(1, network.disconnects.get());
    }

    @Test
    void purgeFailureDoesNotAbortCycle() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient().failPurge();
        MemoryStore store = new MemoryStore();

        CycleOutcome outcome = scheduler(network, store, 2).runCycle();

        Assertions.assertEquals(2, outcome.created());
        Assertions.assertEquals(1, store.saves.get());
    }

    @Test
    void repeatedCyclesKeepHistoryAlignedAndTerminationFinal() {
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient();
        MemoryStore store = new MemoryStore();
        PopulationScheduler scheduler = scheduler(network, store, 20);
        Map<String, ProbeRecord> previous = Map.of();
        Set<String> terminated = new HashSet<>();

        for (int cycle = 0; cycle < 6; cycle++) {
            scheduler.runCycle();
            Map<String, ProbeRecord> saved = store.snapshot();
            Assertions.assertTrue(saved.keySet().containsAll(previous.keySet()), "store shrank in cycle " + cycle);
            long active = saved.values().stream().filter(ProbeRecord::isActive).count();
            Assertions.assertEquals(20L, active);
            for (ProbeRecord record : saved.values()) {
                Assertions.assertEquals(record.evaluationStartUnixtimes().size(), record.evaluationDurationsS().size());
                if (terminated.contains(record.recordKey())) {
                    Assertions.assertNull(record.nextEvaluationUnixtime());
                }
                if (!record.isActive()) {
                    terminated.add(record.recordKey());
                }
            }
            // Knock out a few live probes before the next cycle.
            int lost = 0;
            for (ProbeRecord record : saved.values()) {
                if (record.isActive() && lost < 3) {
                    network.lose(record.recordKey());
                    lost++;
                }
            }
            previous = saved;
            clock.advance(Duration.ofDays(30));
        }
        Assertions.assertFalse(terminated.isEmpty());
    }

    private PopulationScheduler scheduler(InMemoryNetworkProbeClient network, ProbeRecordStore store, int target) {
        SettleWaiter waiter = new SettleWaiter(Duration.ofMillis(10), 5, clock, d -> {
        });
        ProbeCreator creator = new ProbeCreator(waiter, INTERVALS, 1, 2_000, new Random(7L), clock, AuditLogger.disabled());
        return new PopulationScheduler(
                network,
                store,
                new EvaluationExecutor(clock, AuditLogger.disabled()),
                creator,
                target,
                8,
                "purge routes",
                clock,
                AuditLogger.disabled()
        );
    }

    private static final class MemoryStore implements ProbeRecordStore {
        final AtomicInteger loads = new AtomicInteger();
        final AtomicInteger saves = new AtomicInteger();
        volatile boolean corrupt;
        private Map<String, ProbeRecord> records = new LinkedHashMap<>();

        MemoryStore(ProbeRecord... initial) {
            for (ProbeRecord record : initial) {
                records.put(record.recordKey(), record);
            }
        }

        Map<String, ProbeRecord> snapshot() {
            return new LinkedHashMap<>(records);
        }

        @Override
        public Map<String, ProbeRecord> load() {
            loads.incrementAndGet();
            if (corrupt) {
                throw new CorruptStoreException("not json");
            }
            return new LinkedHashMap<>(records);
        }

        @Override
        public void save(Map<String, ProbeRecord> snapshot) {
            saves.incrementAndGet();
            records = new LinkedHashMap<>(snapshot);
        }

        @Override
        public String location() {
            return "memory";
        }
    }
}
