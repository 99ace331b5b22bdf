package io.dhtprobe.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State of one DHT record under test.
 *
 * <p>Instances are immutable; an evaluation produces a new instance that
 * replaces the previous one in the store. A null {@code nextEvaluationUnixtime}
 * marks the probe as terminally failed.
 */
@JsonPropertyOrder({
        "record_key",
        "payload_size_bytes",
        "payload_sha256",
        "evaluation_interval_h",
        "created_unixtime",
        "settle_duration_s",
        "next_evaluation_unixtime",
        "evaluation_start_unixtimes",
        "evaluation_durations_s",
        "failure_reason"
})
public record ProbeRecord(
        @JsonProperty("record_key") String recordKey,
        @JsonProperty("payload_size_bytes") int payloadSizeBytes,
        @JsonProperty("payload_sha256") String payloadSha256,
        @JsonProperty("evaluation_interval_h") int evaluationIntervalH,
        @JsonProperty("created_unixtime") Double createdUnixtime,
        @JsonProperty("settle_duration_s") Double settleDurationS,
        @JsonProperty("next_evaluation_unixtime") Double nextEvaluationUnixtime,
        @JsonProperty("evaluation_start_unixtimes") List<Double> evaluationStartUnixtimes,
        @JsonProperty("evaluation_durations_s") List<Double> evaluationDurationsS,
        @JsonProperty("failure_reason") String failureReason
) {
    public static final double SECONDS_PER_HOUR = 3600.0d;

    public ProbeRecord {
        if (recordKey == null || recordKey.isBlank()) {
            throw new IllegalArgumentException("record_key must not be blank");
        }
        if (evaluationIntervalH <= 0) {
            throw new IllegalArgumentException("evaluation_interval_h must be positive: " + evaluationIntervalH);
        }
        evaluationStartUnixtimes = evaluationStartUnixtimes == null ? List.of() : List.copyOf(evaluationStartUnixtimes);
        evaluationDurationsS = evaluationDurationsS == null ? List.of() : List.copyOf(evaluationDurationsS);
        if (evaluationStartUnixtimes.size() != evaluationDurationsS.size()) {
            throw new IllegalArgumentException("evaluation history misaligned for " + recordKey
                    + ": starts=" + evaluationStartUnixtimes.size()
                    + " durations=" + evaluationDurationsS.size());
        }
    }

    @JsonCreator
    static ProbeRecord fromJson(
            @JsonProperty("record_key") String recordKey,
            @JsonProperty("payload_size_bytes") @JsonAlias("payload_size_b") Integer payloadSizeBytes,
            @JsonProperty("payload_sha256") String payloadSha256,
            @JsonProperty("evaluation_interval_h") @JsonAlias({"evaluation_time_interval_h", "fetch_time_interval_hours"})
            Integer evaluationIntervalH,
            @JsonProperty("created_unixtime") Double createdUnixtime,
            @JsonProperty("settle_duration_s") Double settleDurationS,
            @JsonProperty("next_evaluation_unixtime") Double nextEvaluationUnixtime,
            @JsonProperty("evaluation_start_unixtimes") List<Double> evaluationStartUnixtimes,
            @JsonProperty("evaluation_durations_s") List<Double> evaluationDurationsS,
            @JsonProperty("failure_reason") String failureReason
    ) {
        if (payloadSizeBytes == null) {
            throw new IllegalArgumentException("payload_size_bytes missing for " + recordKey);
        }
        if (evaluationIntervalH == null) {
            throw new IllegalArgumentException("evaluation_interval_h missing for " + recordKey);
        }
        return new ProbeRecord(
                recordKey,
                payloadSizeBytes,
                payloadSha256,
                evaluationIntervalH,
                createdUnixtime,
                settleDurationS,
                nextEvaluationUnixtime,
                evaluationStartUnixtimes,
                evaluationDurationsS,
                failureReason
        );
    }

    public static ProbeRecord activated(
            String recordKey,
            int payloadSizeBytes,
            String payloadSha256,
            int evaluationIntervalH,
            double createdUnixtime,
            double settleDurationS
    ) {
        return new ProbeRecord(
                recordKey,
                payloadSizeBytes,
                payloadSha256,
                evaluationIntervalH,
                createdUnixtime,
                settleDurationS,
                createdUnixtime,
                List.of(),
                List.of(),
                null
        );
    }

    @JsonIgnore
    public boolean isActive() {
        return nextEvaluationUnixtime != null;
    }

    @JsonIgnore
    public boolean isDue(double nowUnixtime) {
        return nextEvaluationUnixtime != null && nextEvaluationUnixtime < nowUnixtime;
    }

    @JsonIgnore
    public int evaluationCount() {
        return evaluationStartUnixtimes.size();
    }

    /**
     * Advances the schedule from the previously scheduled time, not from the
     * evaluation time, so delayed cycles do not accumulate drift.
     */
    public ProbeRecord withSuccessfulEvaluation(double startUnixtime, double durationS) {
        if (nextEvaluationUnixtime == null) {
            throw new IllegalStateException("probe already terminated: " + recordKey);
        }
        return new ProbeRecord(
                recordKey,
                payloadSizeBytes,
                payloadSha256,
                evaluationIntervalH,
                createdUnixtime,
                settleDurationS,
                nextEvaluationUnixtime + evaluationIntervalH * SECONDS_PER_HOUR,
                append(evaluationStartUnixtimes, startUnixtime),
                append(evaluationDurationsS, durationS),
                failureReason
        );
    }

    public ProbeRecord withFailedEvaluation(double startUnixtime, double durationS, String reason) {
        return new ProbeRecord(
                recordKey,
                payloadSizeBytes,
                payloadSha256,
                evaluationIntervalH,
                createdUnixtime,
                settleDurationS,
                null,
                append(evaluationStartUnixtimes, startUnixtime),
                append(evaluationDurationsS, durationS),
                Objects.requireNonNullElse(reason, "unknown")
        );
    }

    private static List<Double> append(List<Double> values, double value) {
        List<Double> out = new ArrayList<>(values.size() + 1);
        out.addAll(values);
        out.add(value);
        return out;
    }
}
