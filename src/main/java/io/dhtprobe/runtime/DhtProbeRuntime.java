package io.dhtprobe.runtime;

import io.dhtprobe.analysis.ProbeLifetimeReport;
import io.dhtprobe.config.ProbeConfig;
import io.dhtprobe.config.ProbeSettings;
import io.dhtprobe.model.ProbeRecord;
import io.dhtprobe.network.NetworkProbeClient;
import io.dhtprobe.network.veilid.VeilidJsonApiClient;
import io.dhtprobe.observability.AuditLogger;
import io.dhtprobe.storage.CycleLock;
import io.dhtprobe.storage.ProbeRecordStore;
import io.dhtprobe.storage.ProbeRecordStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

/**
 * Wires configuration, network client, store and lifecycle components for the
 * command line.
 */
public final class DhtProbeRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(DhtProbeRuntime.class);

    private final ProbeConfig config;
    private final ProbeSettings settings;
    private final NetworkProbeClient client;
    private final ProbeRecordStore store;
    private final Clock clock;
    private final Random random;
    private final AuditLogger auditLogger;

    public DhtProbeRuntime(ProbeConfig config, ProbeSettings settings) {
        this(
                config,
                settings,
                new VeilidJsonApiClient(
                        settings.apiHost(),
                        settings.apiPort(),
                        settings.apiConnectTimeout(),
                        settings.apiRequestTimeout()
                ),
                ProbeRecordStores.forLocation(config.storeLocation()),
                Clock.systemUTC(),
                new SecureRandom()
        );
    }

    public DhtProbeRuntime(
            ProbeConfig config,
            ProbeSettings settings,
            NetworkProbeClient client,
            ProbeRecordStore store,
            Clock clock,
            Random random
    ) {
        this.config = config;
        this.settings = settings;
        this.client = client;
        this.store = store;
        this.clock = clock;
        this.random = random;
        this.auditLogger = config.auditFile() == null
                ? AuditLogger.disabled()
                : new AuditLogger(config.auditFile(), clock);
    }

    /**
     * Runs one maintenance cycle under the cycle lock. Returns a skipped
     * outcome without touching the store when another cycle holds the lock.
     */
    public CycleOutcome runCycle() {
        Optional<CycleLock> maybeLock = CycleLock.tryAcquire(config.lockFile());
        if (maybeLock.isEmpty()) {
            LOG.warn("Another maintenance cycle holds {}, skipping", config.lockFile());
            return CycleOutcome.skipped("Another cycle holds the lock: " + config.lockFile());
        }
        try (CycleLock ignored = maybeLock.get()) {
            return scheduler().runCycle();
        }
    }

    public StatusOutcome status() {
        Map<String, ProbeRecord> records = store.load();
        double now = Unixtime.now(clock);
        int active = 0;
        int due = 0;
        Double nextDue = null;
        Map<Integer, Integer> activeByInterval = new TreeMap<>();
        for (ProbeRecord record : records.values()) {
            if (!record.isActive()) {
                continue;
            }
            active++;
            activeByInterval.merge(record.evaluationIntervalH(), 1, Integer::sum);
            if (record.isDue(now)) {
                due++;
            } else if (nextDue == null || record.nextEvaluationUnixtime() < nextDue) {
                nextDue = record.nextEvaluationUnixtime();
            }
        }
        return new StatusOutcome(
                store.location(),
                records.size(),
                active,
                records.size() - active,
                due,
                nextDue,
                settings.targetPopulation(),
                activeByInterval
        );
    }

    public ProbeLifetimeReport report() {
        return ProbeLifetimeReport.from(store.load().values());
    }

    PopulationScheduler scheduler() {
        SettleWaiter settleWaiter = new SettleWaiter(
                settings.settlePollInterval(),
                settings.settleMaxAttempts(),
                clock
        );
        ProbeCreator creator = new ProbeCreator(
                settleWaiter,
                settings.evaluationIntervalsH(),
                settings.payloadMinBytes(),
                settings.payloadMaxBytes(),
                random,
                clock,
                auditLogger
        );
        return new PopulationScheduler(
                client,
                store,
                new EvaluationExecutor(clock, auditLogger),
                creator,
                settings.targetPopulation(),
                settings.maxConcurrency(),
                settings.purgeCommand(),
                clock,
                auditLogger
        );
    }

    public record StatusOutcome(
            String storeLocation,
            int totalProbes,
            int activeProbes,
            int terminatedProbes,
            int dueNow,
            Double nextDueUnixtime,
            int targetPopulation,
            Map<Integer, Integer> activeByIntervalH
    ) {
    }
}
