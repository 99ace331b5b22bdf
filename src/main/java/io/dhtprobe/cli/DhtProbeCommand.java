package io.dhtprobe.cli;

import io.dhtprobe.analysis.ProbeLifetimeReport;
import io.dhtprobe.config.ProbeConfig;
import io.dhtprobe.config.ProbeSettings;
import io.dhtprobe.error.ConnectionUnavailableException;
import io.dhtprobe.error.CorruptStoreException;
import io.dhtprobe.error.StoreAccessException;
import io.dhtprobe.runtime.CycleOutcome;
import io.dhtprobe.runtime.DhtProbeRuntime;
import io.dhtprobe.storage.ProbeRecordStores;
import io.dhtprobe.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "dhtprobe",
        mixinStandardHelpOptions = true,
        description = "Measures availability and retention of DHT records",
        subcommands = {
                DhtProbeCommand.CycleCommand.class,
                DhtProbeCommand.StatusCommand.class,
                DhtProbeCommand.ReportCommand.class
        }
)
public final class DhtProbeCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_CORRUPT_STORE = 2;
    static final int EXIT_CONNECTION_UNAVAILABLE = 3;
    static final int EXIT_STORE_ACCESS = 4;
    static final long GRACEFUL_SHUTDOWN_MS = 60_000L;

    private static final Logger LOG = LoggerFactory.getLogger(DhtProbeCommand.class);

    @Option(names = {"--store"}, defaultValue = ProbeConfig.DEFAULT_STORE_LOCATION,
            description = "Probe store: local JSON file path or http(s) URL")
    String store;

    @Option(names = {"--settings"}, defaultValue = ProbeConfig.DEFAULT_SETTINGS_FILE,
            description = "Optional JSON settings file")
    String settingsFile;

    @Option(names = {"--lock-file"}, description = "Cycle lock file; defaults to <store>.lock for local stores")
    String lockFile;

    @Option(names = {"--audit-log"}, description = "Append probe events as JSON lines to this file")
    String auditLog;

    @Option(names = {"--target-population"}, description = "Number of active probes to maintain")
    Integer targetPopulation;

    @Option(names = {"--api-host"}, description = "veilid-server JSON API host")
    String apiHost;

    @Option(names = {"--api-port"}, description = "veilid-server JSON API port")
    Integer apiPort;

    @Option(names = {"--max-concurrency"}, description = "Upper bound on simultaneous probe tasks")
    Integer maxConcurrency;

    @Override
    public void run() {
        System.out.println("Use subcommands: cycle | status | report");
    }

    ProbeConfig config() {
        return ProbeConfig.resolve(store, settingsFile, lockFile, auditLog);
    }

    ProbeSettings settings(ProbeConfig config) {
        return ProbeSettings.load(config.settingsFile())
                .withOverrides(targetPopulation, apiHost, apiPort, maxConcurrency);
    }

    DhtProbeRuntime runtime() {
        ProbeConfig config = config();
        return new DhtProbeRuntime(config, settings(config));
    }

    static int fatal(RuntimeException e) {
        int code;
        if (e instanceof CorruptStoreException) {
            code = EXIT_CORRUPT_STORE;
        } else if (e instanceof ConnectionUnavailableException) {
            code = EXIT_CONNECTION_UNAVAILABLE;
        } else if (e instanceof StoreAccessException) {
            code = EXIT_STORE_ACCESS;
        } else {
            throw e;
        }
        LOG.error("{}", e.getMessage(), e);
        System.err.println(e.getMessage());
        return code;
    }

    @Command(name = "cycle", description = "Run one maintenance cycle: evaluate due probes, refill population, save")
    static final class CycleCommand implements Callable<Integer> {
        @ParentCommand
        DhtProbeCommand parent;

        @Option(names = {"--repeat-every-s"}, defaultValue = "0",
                description = "Keep running a cycle every N seconds; 0 runs once")
        long repeatEverySeconds;

        @Override
        public Integer call() throws Exception {
            DhtProbeRuntime runtime = parent.runtime();
            if (repeatEverySeconds <= 0) {
                try {
                    CycleOutcome outcome = runtime.runCycle();
                    System.out.println(Jsons.toJson(outcome));
                    return EXIT_OK;
                } catch (RuntimeException e) {
                    return fatal(e);
                }
            }
            AtomicBoolean running = new AtomicBoolean(true);
            AtomicBoolean inCycle = new AtomicBoolean(false);
            // Let an in-flight cycle reach its save before the JVM halts.
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                long deadline = System.currentTimeMillis() + GRACEFUL_SHUTDOWN_MS;
                try {
                    while (inCycle.get() && System.currentTimeMillis() < deadline) {
                        Thread.sleep(100L);
                    }
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "dhtprobe-shutdown-hook"));
            while (running.get()) {
                inCycle.set(true);
                try {
                    CycleOutcome outcome = runtime.runCycle();
                    System.out.println(Jsons.toJson(outcome));
                } catch (ConnectionUnavailableException e) {
                    LOG.warn("Cycle aborted, will retry: {}", e.getMessage());
                } catch (RuntimeException e) {
                    return fatal(e);
                } finally {
                    inCycle.set(false);
                }
                long deadline = System.currentTimeMillis() + repeatEverySeconds * 1000L;
                while (running.get() && System.currentTimeMillis() < deadline) {
                    Thread.sleep(Math.min(500L, Math.max(1L, deadline - System.currentTimeMillis())));
                }
            }
            LOG.info("Probe loop stopped");
            return EXIT_OK;
        }
    }

    @Command(name = "status", description = "Summarize the probe store")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        DhtProbeCommand parent;

        @Override
        public Integer call() {
            try {
                DhtProbeRuntime.StatusOutcome status = parent.runtime().status();
                System.out.println(Jsons.toJson(status));
                return EXIT_OK;
            } catch (RuntimeException e) {
                return fatal(e);
            }
        }
    }

    @Command(name = "report", description = "Lifetime and payload-size distributions of the probes")
    static final class ReportCommand implements Callable<Integer> {
        @ParentCommand
        DhtProbeCommand parent;

        @Parameters(index = "0", arity = "0..1",
                description = "Store to analyze (file path or http(s) URL); defaults to --store")
        String source;

        @Override
        public Integer call() {
            try {
                ProbeLifetimeReport report = source == null || source.isBlank()
                        ? parent.runtime().report()
                        : ProbeLifetimeReport.from(ProbeRecordStores.forLocation(source).load().values());
                System.out.println(Jsons.toJson(report));
                return EXIT_OK;
            } catch (RuntimeException e) {
                return fatal(e);
            }
        }
    }
}
