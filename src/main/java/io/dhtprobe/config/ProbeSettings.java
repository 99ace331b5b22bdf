package io.dhtprobe.config;

import io.dhtprobe.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Tunables of the probe lifecycle. Values missing from the settings file fall
 * back to the defaults in {@link ProbeConfig}; out-of-range values are clamped.
 */
public record ProbeSettings(
        int targetPopulation,
        List<Integer> evaluationIntervalsH,
        int payloadMinBytes,
        int payloadMaxBytes,
        long settlePollIntervalMs,
        int settleMaxAttempts,
        int maxConcurrency,
        String apiHost,
        int apiPort,
        long apiConnectTimeoutMs,
        long apiRequestTimeoutMs,
        String purgeCommand
) {
    public ProbeSettings {
        evaluationIntervalsH = List.copyOf(evaluationIntervalsH);
    }

    public static ProbeSettings defaults() {
        return new ProbeSettings(
                ProbeConfig.DEFAULT_TARGET_POPULATION,
                ProbeConfig.DEFAULT_EVALUATION_INTERVALS_H,
                ProbeConfig.DEFAULT_PAYLOAD_MIN_BYTES,
                ProbeConfig.DEFAULT_PAYLOAD_MAX_BYTES,
                ProbeConfig.DEFAULT_SETTLE_POLL_INTERVAL_MS,
                ProbeConfig.DEFAULT_SETTLE_MAX_ATTEMPTS,
                ProbeConfig.DEFAULT_MAX_CONCURRENCY,
                ProbeConfig.DEFAULT_API_HOST,
                ProbeConfig.DEFAULT_API_PORT,
                ProbeConfig.DEFAULT_API_CONNECT_TIMEOUT_MS,
                ProbeConfig.DEFAULT_API_REQUEST_TIMEOUT_MS,
                ProbeConfig.DEFAULT_PURGE_COMMAND
        );
    }

    /**
     * Reads the settings file if it exists, otherwise returns the defaults.
     */
    public static ProbeSettings load(Path settingsFile) {
        ProbeSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load probe settings: " + settingsFile, e);
        }
    }

    static ProbeSettings fromFile(SettingsFile file, ProbeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int payloadMin = sanitizeInt(file.payloadMinBytes(), defaults.payloadMinBytes(), 1);
        int payloadMax = sanitizeInt(file.payloadMaxBytes(), defaults.payloadMaxBytes(), payloadMin);
        if (payloadMax < payloadMin) {
            payloadMax = payloadMin;
        }
        return new ProbeSettings(
                sanitizeInt(file.targetPopulation(), defaults.targetPopulation(), 0),
                sanitizeIntervals(file.evaluationIntervalsH(), defaults.evaluationIntervalsH()),
                payloadMin,
                payloadMax,
                sanitizeLong(file.settlePollIntervalMs(), defaults.settlePollIntervalMs(), 0L),
                sanitizeInt(file.settleMaxAttempts(), defaults.settleMaxAttempts(), 1),
                sanitizeInt(file.maxConcurrency(), defaults.maxConcurrency(), 1),
                sanitizeText(file.apiHost(), defaults.apiHost()),
                sanitizePort(file.apiPort(), defaults.apiPort()),
                sanitizeLong(file.apiConnectTimeoutMs(), defaults.apiConnectTimeoutMs(), 100L),
                sanitizeLong(file.apiRequestTimeoutMs(), defaults.apiRequestTimeoutMs(), 100L),
                sanitizeText(file.purgeCommand(), defaults.purgeCommand())
        );
    }

    public ProbeSettings withOverrides(Integer targetPopulation, String apiHost, Integer apiPort, Integer maxConcurrency) {
        return new ProbeSettings(
                sanitizeInt(targetPopulation, this.targetPopulation, 0),
                evaluationIntervalsH,
                payloadMinBytes,
                payloadMaxBytes,
                settlePollIntervalMs,
                settleMaxAttempts,
                sanitizeInt(maxConcurrency, this.maxConcurrency, 1),
                sanitizeText(apiHost, this.apiHost),
                sanitizePort(apiPort, this.apiPort),
                apiConnectTimeoutMs,
                apiRequestTimeoutMs,
                purgeCommand
        );
    }

    public Duration settlePollInterval() {
        return Duration.ofMillis(settlePollIntervalMs);
    }

    public Duration apiConnectTimeout() {
        return Duration.ofMillis(apiConnectTimeoutMs);
    }

    public Duration apiRequestTimeout() {
        return Duration.ofMillis(apiRequestTimeoutMs);
    }

    private static List<Integer> sanitizeIntervals(List<Integer> raw, List<Integer> fallback) {
        if (raw == null) {
            return fallback;
        }
        LinkedHashSet<Integer> unique = new LinkedHashSet<>();
        for (Integer hours : raw) {
            if (hours != null && hours > 0) {
                unique.add(hours);
            }
        }
        return unique.isEmpty() ? fallback : new ArrayList<>(unique);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizePort(Integer raw, int fallback) {
        if (raw == null || raw <= 0 || raw > 65535) {
            return fallback;
        }
        return raw;
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    record SettingsFile(
            Integer targetPopulation,
            List<Integer> evaluationIntervalsH,
            Integer payloadMinBytes,
            Integer payloadMaxBytes,
            Long settlePollIntervalMs,
            Integer settleMaxAttempts,
            Integer maxConcurrency,
            String apiHost,
            Integer apiPort,
            Long apiConnectTimeoutMs,
            Long apiRequestTimeoutMs,
            String purgeCommand
    ) {
    }
}
