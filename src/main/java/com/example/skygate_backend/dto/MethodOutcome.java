package com.example.skygate_backend.dto;

import com.example.skygate_backend.util.OutcomeStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one analyzer invocation. {@code score} is set only for {@link OutcomeStatus#OK};
 * failed and skipped outcomes carry a {@code reason} instead.
 */
public record MethodOutcome(
        String methodName,
        OutcomeStatus status,
        Double score,
        String reason,
        Map<String, Object> detail,
        Duration processingTime
) {
    public static final String ANALYSIS_KEY = "analysis";

    public MethodOutcome {
        Objects.requireNonNull(methodName, "methodName");
        Objects.requireNonNull(status, "status");
        if (status == OutcomeStatus.OK) {
            if (score == null || score.isNaN() || score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException("score must be in [0,1] for an ok outcome of " + methodName + ", got: " + score);
            }
        } else {
            if (score != null) {
                throw new IllegalArgumentException("score must be absent for a " + status + " outcome of " + methodName);
            }
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason is required for a " + status + " outcome of " + methodName);
            }
        }
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
        processingTime = processingTime == null ? Duration.ZERO : processingTime;
    }

    public static MethodOutcome ok(String methodName, double score, Map<String, Object> detail, Duration processingTime) {
        return new MethodOutcome(methodName, OutcomeStatus.OK, score, null, detail, processingTime);
    }

    public static MethodOutcome failed(String methodName, String reason, Duration processingTime) {
        return new MethodOutcome(methodName, OutcomeStatus.FAILED, null, reason, Map.of(), processingTime);
    }

    public static MethodOutcome skipped(String methodName, String reason, Map<String, Object> detail, Duration processingTime) {
        return new MethodOutcome(methodName, OutcomeStatus.SKIPPED, null, reason, detail, processingTime);
    }

    public boolean isOk() {
        return status == OutcomeStatus.OK;
    }

    /** One-line explanation from {@code detail.analysis}, falling back to the reason. */
    public String analysis() {
        Object value = detail.get(ANALYSIS_KEY);
        if (value != null) {
            return value.toString();
        }
        return reason != null ? reason : methodName;
    }
}
