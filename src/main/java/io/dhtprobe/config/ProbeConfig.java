package io.dhtprobe.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Locations used by one probe process plus the defaults for {@link ProbeSettings}.
 */
public final class ProbeConfig {
    public static final String DEFAULT_STORE_LOCATION = "dhtprobe-stats.json";
    public static final String DEFAULT_SETTINGS_FILE = "dhtprobe-settings.json";
    public static final int DEFAULT_TARGET_POPULATION = 100;
    public static final List<Integer> DEFAULT_EVALUATION_INTERVALS_H = List.of(1, 12, 24, 168, 672);
    public static final int DEFAULT_PAYLOAD_MIN_BYTES = 1;
    public static final int DEFAULT_PAYLOAD_MAX_BYTES = 32_000;
    public static final long DEFAULT_SETTLE_POLL_INTERVAL_MS = 1_000L;
    public static final int DEFAULT_SETTLE_MAX_ATTEMPTS = 300;
    public static final int DEFAULT_MAX_CONCURRENCY = 16;
    public static final String DEFAULT_API_HOST = "127.0.0.1";
    public static final int DEFAULT_API_PORT = 5959;
    public static final long DEFAULT_API_CONNECT_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_API_REQUEST_TIMEOUT_MS = 60_000L;
    public static final String DEFAULT_PURGE_COMMAND = "purge routes";

    private final String storeLocation;
    private final Path settingsFile;
    private final Path lockFile;
    private final Path auditFile;

    public ProbeConfig(String storeLocation, Path settingsFile, Path lockFile, Path auditFile) {
        this.storeLocation = storeLocation;
        this.settingsFile = settingsFile;
        this.lockFile = lockFile;
        this.auditFile = auditFile;
    }

    /**
     * Resolves locations. A local store keeps its lock file next to it; a remote
     * store locks in the working directory. A null audit path disables the audit trail.
     */
    public static ProbeConfig resolve(String storeLocation, String settingsFile, String lockFile, String auditFile) {
        String store = storeLocation == null || storeLocation.isBlank()
                ? DEFAULT_STORE_LOCATION
                : storeLocation.trim();
        Path settings = Paths.get(settingsFile == null || settingsFile.isBlank() ? DEFAULT_SETTINGS_FILE : settingsFile.trim())
                .toAbsolutePath()
                .normalize();
        Path lock;
        if (lockFile != null && !lockFile.isBlank()) {
            lock = Paths.get(lockFile.trim()).toAbsolutePath().normalize();
        } else if (isRemote(store)) {
            lock = Paths.get("dhtprobe.lock").toAbsolutePath().normalize();
        } else {
            Path storePath = Paths.get(store).toAbsolutePath().normalize();
            lock = storePath.resolveSibling(storePath.getFileName() + ".lock");
        }
        Path audit = auditFile == null || auditFile.isBlank()
                ? null
                : Paths.get(auditFile.trim()).toAbsolutePath().normalize();
        return new ProbeConfig(store, settings, lock, audit);
    }

    public static boolean isRemote(String location) {
        if (location == null) {
            return false;
        }
        String lower = location.trim().toLowerCase();
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    public String storeLocation() {
        return storeLocation;
    }

    public Path settingsFile() {
        return settingsFile;
    }

    public Path lockFile() {
        return lockFile;
    }

    public Path auditFile() {
        return auditFile;
    }
}
