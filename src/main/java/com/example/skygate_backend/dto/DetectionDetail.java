package com.example.skygate_backend.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Document-store payload of one run: the aggregated block plus one entry per method outcome.
 */
public record DetectionDetail(
        UUID referenceKey,
        String uploadReference,
        String algorithmVersion,
        boolean aiGenerated,
        double confidenceScore,
        List<String> contributingFactors,
        List<Map<String, Object>> outcomes,
        Instant createdAt
) {
    public DetectionDetail {
        contributingFactors = List.copyOf(contributingFactors);
        outcomes = List.copyOf(outcomes);
    }
}
