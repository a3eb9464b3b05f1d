package com.example.skygate_backend.service;

import com.example.skygate_backend.dto.StoredDetection;
import com.example.skygate_backend.model.DetectionDetailDocument;
import com.example.skygate_backend.model.DetectionResult;
import com.example.skygate_backend.repository.DetectionDetailRepository;
import com.example.skygate_backend.repository.DetectionResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class ResultQueryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultQueryService.class);

    /** Summary-only view used for an upload's history. */
    public record HistoryEntry(UUID referenceKey, boolean aiGenerated, BigDecimal confidenceScore,
                               String algorithmVersion, String resultSummary, Map<String, Double> methodScores,
                               Instant detectedAt) {
    }

    private final DetectionResultRepository resultRepo;
    private final DetectionDetailRepository detailRepo;

    public ResultQueryService(DetectionResultRepository resultRepo, DetectionDetailRepository detailRepo) {
        this.resultRepo = resultRepo;
        this.detailRepo = detailRepo;
    }

    @Transactional(readOnly = true)
    public Optional<StoredDetection> find(UUID referenceKey) {
        return resultRepo.findById(referenceKey).map(this::combine);
    }

    /** Every run of one upload, newest first. */
    @Transactional(readOnly = true)
    public List<HistoryEntry> history(String uploadReference) {
        return resultRepo.findByUploadReferenceOrderByDetectedAtDesc(uploadReference).stream()
                .map(r -> new HistoryEntry(r.getId(), r.isAiGenerated(), r.getConfidenceScore(), r.getAlgorithmVersion(),
                        r.getResultSummary(), r.getMethodScores() == null ? Map.of() : Map.copyOf(r.getMethodScores()),
                        r.getDetectedAt()))
                .toList();
    }

    private StoredDetection combine(DetectionResult row) {
        Optional<DetectionDetailDocument> detail = detailRepo.findByReferenceKey(row.getId().toString());
        if (detail.isEmpty()) {
            LOGGER.warn("Detail document missing for key={} upload={}", row.getId(), row.getUploadReference());
        }
        List<String> factors = detail.map(DetectionDetailDocument::getAggregated)
                .map(DetectionDetailDocument.Aggregate::getContributingFactors)
                .map(List::copyOf)
                .orElse(List.of());
        List<Map<String, Object>> outcomes = detail.map(DetectionDetailDocument::getOutcomes)
                .map(List::copyOf)
                .orElse(List.of());
        return new StoredDetection(row.getId(), row.getUploadReference(), row.isAiGenerated(), row.getConfidenceScore(),
                row.getAlgorithmVersion(), row.getResultSummary(), row.getDetectedAt(), factors, outcomes, detail.isEmpty());
    }
}
