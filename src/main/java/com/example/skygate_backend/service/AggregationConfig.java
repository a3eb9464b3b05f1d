package com.example.skygate_backend.service;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable combination parameters for one detection run.
 *
 * @param weights              per-method weights, methods absent here get {@code defaultWeight}
 * @param decisionThreshold    confidence at or above which a verdict is "AI-generated"
 * @param topFactors           number of contributing factors to report
 * @param weightTableId        identifier of the weight table, part of the algorithm version
 * @param modelRegistryVersion loaded model set, part of the algorithm version
 */
public record AggregationConfig(
        Map<String, Double> weights,
        double defaultWeight,
        double decisionThreshold,
        int topFactors,
        String weightTableId,
        String modelRegistryVersion
) {
    public static final double DEFAULT_WEIGHT = 1.0;
    public static final double DEFAULT_THRESHOLD = 0.5;
    public static final int DEFAULT_TOP_FACTORS = 5;
    public static final String DEFAULT_WEIGHT_TABLE_ID = "weights-v1";

    public AggregationConfig {
        weights = Map.copyOf(Objects.requireNonNull(weights, "weights"));
        weights.forEach((method, w) -> {
            if (w == null || w.isNaN() || w < 0.0) {
                throw new IllegalArgumentException("weight for " + method + " must be >= 0, got: " + w);
            }
        });
        if (Double.isNaN(defaultWeight) || defaultWeight < 0.0) {
            throw new IllegalArgumentException("defaultWeight must be >= 0, got: " + defaultWeight);
        }
        if (Double.isNaN(decisionThreshold) || decisionThreshold < 0.0 || decisionThreshold > 1.0) {
            throw new IllegalArgumentException("decisionThreshold must be in [0,1], got: " + decisionThreshold);
        }
        if (topFactors < 1) {
            throw new IllegalArgumentException("topFactors must be >= 1, got: " + topFactors);
        }
        if (weightTableId == null || weightTableId.isBlank()) {
            throw new IllegalArgumentException("weightTableId is required");
        }
        modelRegistryVersion = modelRegistryVersion == null ? "" : modelRegistryVersion;
    }

    public static AggregationConfig defaults(Map<String, Double> weights, String modelRegistryVersion) {
        return new AggregationConfig(weights, DEFAULT_WEIGHT, DEFAULT_THRESHOLD, DEFAULT_TOP_FACTORS,
                DEFAULT_WEIGHT_TABLE_ID, modelRegistryVersion);
    }

    public double weightFor(String methodName) {
        return weights.getOrDefault(methodName, defaultWeight);
    }

    public String algorithmVersion() {
        return weightTableId + "/" + modelRegistryVersion;
    }
}
