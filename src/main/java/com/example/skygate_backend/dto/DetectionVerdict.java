package com.example.skygate_backend.dto;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate result of one detection run. Immutable; a later run supersedes it rather than changing it.
 *
 * @param contributingFactors human-readable explanations, most influential first
 * @param methodOutcomes      every outcome of the run, including failed and skipped ones
 * @param algorithmVersion    weight table and model registry used for the combination
 */
public record DetectionVerdict(
        boolean aiGenerated,
        double confidenceScore,
        List<String> contributingFactors,
        List<MethodOutcome> methodOutcomes,
        String algorithmVersion
) {
    public DetectionVerdict {
        if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be in [0,1], got: " + confidenceScore);
        }
        contributingFactors = List.copyOf(contributingFactors);
        methodOutcomes = List.copyOf(methodOutcomes);
        Objects.requireNonNull(algorithmVersion, "algorithmVersion");
    }
}
