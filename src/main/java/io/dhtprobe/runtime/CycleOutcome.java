package io.dhtprobe.runtime;

public record CycleOutcome(
        boolean skipped,
        String message,
        int totalBefore,
        int due,
        int evaluatedOk,
        int evaluationFailures,
        int deficit,
        int created,
        int creationFailures,
        int activeAfter,
        int totalAfter,
        long durationMs
) {
    public static CycleOutcome skipped(String message) {
        return new CycleOutcome(true, message, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0L);
    }
}
