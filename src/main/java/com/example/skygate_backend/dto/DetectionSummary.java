package com.example.skygate_backend.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/** Structured fields written to the relational store for one verdict. */
public record DetectionSummary(
        String uploadReference,
        boolean aiGenerated,
        BigDecimal confidenceScore,
        long slowestMethodMs,
        String algorithmVersion,
        String resultSummary,
        Map<String, Double> methodScores,
        Instant detectedAt
) {
}
