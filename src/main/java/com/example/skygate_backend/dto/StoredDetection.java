package com.example.skygate_backend.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read view combining the relational summary with the nested detail document.
 *
 * @param outcomes      nested per-method entries, empty when {@code detailMissing}
 * @param detailMissing the summary exists but its detail document could not be found
 */
public record StoredDetection(
        UUID referenceKey,
        String uploadReference,
        boolean aiGenerated,
        BigDecimal confidenceScore,
        String algorithmVersion,
        String resultSummary,
        Instant detectedAt,
        List<String> contributingFactors,
        List<Map<String, Object>> outcomes,
        boolean detailMissing
) {
}
