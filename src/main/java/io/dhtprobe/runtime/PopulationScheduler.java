package io.dhtprobe.runtime;

import io.dhtprobe.error.ProbeException;
import io.dhtprobe.error.TransportException;
import io.dhtprobe.model.ProbeRecord;
import io.dhtprobe.network.NetworkProbeClient;
import io.dhtprobe.network.ProbeSession;
import io.dhtprobe.observability.AuditLogger;
import io.dhtprobe.storage.ProbeRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One maintenance cycle: evaluate due probes, top the active population back
 * up to the target, persist.
 *
 * <p>Each batch is a barrier: every task finishes before the cycle moves on,
 * and a failing task never cancels its siblings. Results are merged on the
 * calling thread after the join.
 */
public final class PopulationScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(PopulationScheduler.class);

    private final NetworkProbeClient client;
    private final ProbeRecordStore store;
    private final EvaluationExecutor evaluator;
    private final ProbeCreator creator;
    private final int targetPopulation;
    private final int maxConcurrency;
    private final String purgeCommand;
    private final Clock clock;
    private final AuditLogger auditLogger;

    public PopulationScheduler(
            NetworkProbeClient client,
            ProbeRecordStore store,
            EvaluationExecutor evaluator,
            ProbeCreator creator,
            int targetPopulation,
            int maxConcurrency,
            String purgeCommand,
            Clock clock,
            AuditLogger auditLogger
    ) {
        this.client = client;
        this.store = store;
        this.evaluator = evaluator;
        this.creator = creator;
        this.targetPopulation = Math.max(0, targetPopulation);
        this.maxConcurrency = Math.max(1, maxConcurrency);
        this.purgeCommand = purgeCommand;
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    public CycleOutcome runCycle() {
        long startedNs = System.nanoTime();
        try (ProbeSession session = client.connect()) {
            purgeStaleRoutes(session);

            LinkedHashMap<String, ProbeRecord> records = new LinkedHashMap<>(store.load());
            int totalBefore = records.size();
            double now = Unixtime.now(clock);
            List<ProbeRecord> due = new ArrayList<>();
            for (ProbeRecord record : records.values()) {
                if (record.isDue(now)) {
                    due.add(record);
                }
            }
            LOG.info("Cycle start: records={} due={} target={}", totalBefore, due.size(), targetPopulation);

            List<Callable<ProbeRecord>> evaluations = new ArrayList<>(due.size());
            for (ProbeRecord record : due) {
                evaluations.add(() -> evaluator.evaluate(session, record));
            }
            int evaluatedOk = 0;
            int evaluationFailures = 0;
            for (Optional<ProbeRecord> result : runBatch("evaluate", evaluations)) {
                if (result.isEmpty()) {
                    continue;
                }
                ProbeRecord updated = result.get();
                records.put(updated.recordKey(), updated);
                if (updated.isActive()) {
                    evaluatedOk++;
                } else {
                    evaluationFailures++;
                }
            }

            int activeAfterEvaluation = countActive(records);
            int deficit = Math.max(0, targetPopulation - activeAfterEvaluation);
            List<Callable<Optional<ProbeRecord>>> creations = new ArrayList<>(deficit);
            for (int i = 0; i < deficit; i++) {
                creations.add(() -> creator.create(session));
            }
            int created = 0;
            for (Optional<Optional<ProbeRecord>> result : runBatch("create", creations)) {
                Optional<ProbeRecord> maybe = result.flatMap(r -> r);
                if (maybe.isEmpty()) {
                    continue;
                }
                ProbeRecord record = maybe.get();
                if (records.putIfAbsent(record.recordKey(), record) != null) {
                    LOG.warn("Network returned an existing record key {}, keeping the stored probe", record.recordKey());
                    continue;
                }
                created++;
            }

            store.save(records);

            CycleOutcome outcome = new CycleOutcome(
                    false,
                    "completed",
                    totalBefore,
                    due.size(),
                    evaluatedOk,
                    evaluationFailures,
                    deficit,
                    created,
                    deficit - created,
                    countActive(records),
                    records.size(),
                    (System.nanoTime() - startedNs) / 1_000_000L
            );
            LOG.info("Cycle done: evaluated={} failed={} created={}/{} active={} total={}",
                    evaluatedOk, evaluationFailures, created, deficit, outcome.activeAfter(), outcome.totalAfter());
            auditLogger.log(AuditLogger.AuditEvent.of("cycle.completed", "store/" + store.location(), "ok", Map.of(
                    "due", outcome.due(),
                    "evaluated_ok", evaluatedOk,
                    "evaluation_failures", evaluationFailures,
                    "created", created,
                    "creation_failures", outcome.creationFailures(),
                    "active_after", outcome.activeAfter(),
                    "total_after", outcome.totalAfter()
            )));
            return outcome;
        }
    }

    private void purgeStaleRoutes(ProbeSession session) {
        if (purgeCommand == null || purgeCommand.isBlank()) {
            return;
        }
        try {
            session.debugPurge(purgeCommand);
        } catch (TransportException e) {
            LOG.warn("'{}' failed, continuing: {}", purgeCommand, e.getMessage());
        }
    }

    /**
     * Runs every task and waits for all of them. A task that throws yields an
     * empty slot instead of aborting the batch.
     */
    private <T> List<Optional<T>> runBatch(String name, List<Callable<T>> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(maxConcurrency, tasks.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory(name));
        try {
            List<Future<T>> futures = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                futures.add(pool.submit(task));
            }
            List<Optional<T>> out = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                try {
                    out.add(Optional.ofNullable(future.get()));
                } catch (ExecutionException e) {
                    LOG.error("{} task failed", name, e.getCause());
                    out.add(Optional.empty());
                }
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeException("Cycle interrupted during " + name + " batch", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static int countActive(Map<String, ProbeRecord> records) {
        int active = 0;
        for (ProbeRecord record : records.values()) {
            if (record.isActive()) {
                active++;
            }
        }
        return active;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String name;
        private final AtomicInteger counter = new AtomicInteger();

        private WorkerThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "dhtprobe-" + name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
