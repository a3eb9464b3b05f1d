package com.example.skygate_backend.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full per-method evidence of one detection run, keyed by the reference key of its summary row.
 */
@Document(collection = "detection_details")
public class DetectionDetailDocument {
    @Id
    private String id;
    @Indexed(unique = true)
    private String referenceKey;
    @Indexed
    private String uploadReference;
    private String algorithmVersion;
    private Aggregate aggregated;
    private List<Map<String, Object>> outcomes;
    private Instant createdAt;

    public static class Aggregate {
        private boolean aiGenerated;
        private double confidenceScore;
        private List<String> contributingFactors;

        public Aggregate() {
        }

        public Aggregate(boolean aiGenerated, double confidenceScore, List<String> contributingFactors) {
            this.aiGenerated = aiGenerated;
            this.confidenceScore = confidenceScore;
            this.contributingFactors = contributingFactors;
        }

        public boolean isAiGenerated() { return aiGenerated; }
        public void setAiGenerated(boolean aiGenerated) { this.aiGenerated = aiGenerated; }
        public double getConfidenceScore() { return confidenceScore; }
        public void setConfidenceScore(double confidenceScore) { this.confidenceScore = confidenceScore; }
        public List<String> getContributingFactors() { return contributingFactors; }
        public void setContributingFactors(List<String> contributingFactors) { this.contributingFactors = contributingFactors; }
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getReferenceKey() { return referenceKey; }
    public void setReferenceKey(String referenceKey) { this.referenceKey = referenceKey; }
    public String getUploadReference() { return uploadReference; }
    public void setUploadReference(String uploadReference) { this.uploadReference = uploadReference; }
    public String getAlgorithmVersion() { return algorithmVersion; }
    public void setAlgorithmVersion(String algorithmVersion) { this.algorithmVersion = algorithmVersion; }
    public Aggregate getAggregated() { return aggregated; }
    public void setAggregated(Aggregate aggregated) { this.aggregated = aggregated; }
    public List<Map<String, Object>> getOutcomes() { return outcomes; }
    public void setOutcomes(List<Map<String, Object>> outcomes) { this.outcomes = outcomes; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
