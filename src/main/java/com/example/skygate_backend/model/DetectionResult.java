package com.example.skygate_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Relational summary of one detection run. Rows are never updated; a re-run appends a new row.
 */
@Entity
@Immutable
@Table(
        name = "detection_result",
        indexes = {
                @Index(name = "idx_detection_result_upload", columnList = "upload_reference, detected_at")
        }
)
public class DetectionResult {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;
    @Column(name = "upload_reference", nullable = false, updatable = false)
    private String uploadReference;
    @Column(name = "ai_generated", nullable = false, updatable = false)
    private boolean aiGenerated;
    @Column(name = "confidence_score", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal confidenceScore;
    @Column(name = "slowest_method_ms", nullable = false, updatable = false)
    private long slowestMethodMs;
    @Column(name = "algorithm_version", nullable = false, updatable = false)
    private String algorithmVersion;
    @Column(name = "result_summary", nullable = false, updatable = false, length = 2000)
    private String resultSummary;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "method_scores", updatable = false)
    private Map<String, Double> methodScores;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected DetectionResult() {
    }

    public DetectionResult(String uploadReference, boolean aiGenerated, BigDecimal confidenceScore, long slowestMethodMs,
                           String algorithmVersion, String resultSummary, Map<String, Double> methodScores, Instant detectedAt) {
        this.uploadReference = uploadReference;
        this.aiGenerated = aiGenerated;
        this.confidenceScore = confidenceScore;
        this.slowestMethodMs = slowestMethodMs;
        this.algorithmVersion = algorithmVersion;
        this.resultSummary = resultSummary;
        this.methodScores = methodScores;
        this.detectedAt = detectedAt;
    }

    public UUID getId() { return id; }
    public String getUploadReference() { return uploadReference; }
    public boolean isAiGenerated() { return aiGenerated; }
    public BigDecimal getConfidenceScore() { return confidenceScore; }
    public long getSlowestMethodMs() { return slowestMethodMs; }
    public String getAlgorithmVersion() { return algorithmVersion; }
    public String getResultSummary() { return resultSummary; }
    public Map<String, Double> getMethodScores() { return methodScores; }
    public Instant getDetectedAt() { return detectedAt; }
    public Instant getCreatedAt() { return createdAt; }
}
